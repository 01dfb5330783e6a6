package com.smc.strategy.detectors;

import java.util.ArrayList;
import java.util.List;

import com.smc.market.Horizon;
import com.smc.strategy.Direction;

public record ZoneFindings(
		List<Zone> zones,
		List<FlippedZone> flippedZones,
		List<Retest> retests,
		List<Rejected> rejected) {

	public ZoneFindings {
		zones = List.copyOf(zones);
		flippedZones = List.copyOf(flippedZones);
		retests = List.copyOf(retests);
		rejected = List.copyOf(rejected);
	}

	public static ZoneFindings empty() {
		return new ZoneFindings(List.of(), List.of(), List.of(), List.of());
	}

	public List<ReversalZone> active() {
		List<ReversalZone> active = new ArrayList<>();
		for (Zone zone : zones) {
			if (zone.valid()) {
				active.add(zone);
			}
		}
		active.addAll(flippedZones);
		return active;
	}

	public List<ReversalZone> active(Direction direction) {
		return active().stream()
				.filter(zone -> zone.direction() == direction)
				.toList();
	}

	public record Retest(ReversalZone zone, long candleTime) {
	}

	public record Rejected(Horizon horizon, int sourceIndex, double high, double low, String reason) {
	}
}
