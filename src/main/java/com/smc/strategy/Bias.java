package com.smc.strategy;

public enum Bias {
	BULLISH,
	BEARISH,
	NEUTRAL;

	public Direction direction() {
		return switch (this) {
			case BULLISH -> Direction.BULLISH;
			case BEARISH -> Direction.BEARISH;
			case NEUTRAL -> null;
		};
	}

	public static Bias of(Direction direction) {
		if (direction == null) {
			return NEUTRAL;
		}
		return direction == Direction.BULLISH ? BULLISH : BEARISH;
	}
}
