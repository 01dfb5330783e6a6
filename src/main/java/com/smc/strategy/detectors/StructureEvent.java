package com.smc.strategy.detectors;

import com.smc.strategy.Direction;

public record StructureEvent(Type type, Direction direction, double level, long timestamp) {

	public enum Type {
		STRUCTURAL_BREAK,
		TREND_SHIFT
	}
}
