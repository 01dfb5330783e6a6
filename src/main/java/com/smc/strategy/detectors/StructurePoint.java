package com.smc.strategy.detectors;

public record StructurePoint(double price, Type type, long timestamp) {

	public enum Type {
		SWING_HIGH,
		SWING_LOW
	}
}
