package com.smc.strategy;

public enum Direction {
	BULLISH,
	BEARISH;

	public Direction opposite() {
		return this == BULLISH ? BEARISH : BULLISH;
	}
}
