package com.smc.strategy.detectors;

import java.util.List;
import java.util.Optional;

import com.smc.strategy.Trend;

public record Structure(List<StructurePoint> points, Trend trend, List<StructureEvent> events, boolean sufficient) {

	public Structure {
		points = List.copyOf(points);
		events = List.copyOf(events);
	}

	public static Structure insufficient() {
		return new Structure(List.of(), Trend.RANGING, List.of(), false);
	}

	public Optional<StructurePoint> lastSwingHigh() {
		return last(StructurePoint.Type.SWING_HIGH);
	}

	public Optional<StructurePoint> lastSwingLow() {
		return last(StructurePoint.Type.SWING_LOW);
	}

	public Optional<StructureEvent> lastEvent() {
		return events.isEmpty() ? Optional.empty() : Optional.of(events.get(events.size() - 1));
	}

	private Optional<StructurePoint> last(StructurePoint.Type type) {
		for (int i = points.size() - 1; i >= 0; i--) {
			if (points.get(i).type() == type) {
				return Optional.of(points.get(i));
			}
		}
		return Optional.empty();
	}
}
