package com.smc.strategy;

public enum Trend {
	UPTREND,
	DOWNTREND,
	RANGING;

	public boolean clear() {
		return this != RANGING;
	}

	public Direction direction() {
		return switch (this) {
			case UPTREND -> Direction.BULLISH;
			case DOWNTREND -> Direction.BEARISH;
			case RANGING -> null;
		};
	}
}
