package com.smc.strategy.detectors;

import com.smc.strategy.Direction;

public record LiquidityLevel(double price, Side side, int touchCount, boolean swept, Long sweptAt, long formedAt) {

	public enum Side {
		UPPER,
		LOWER;

		/**
		 * Direction of the reversal expected after this side has been swept.
		 */
		public Direction reversal() {
			return this == UPPER ? Direction.BEARISH : Direction.BULLISH;
		}
	}
}
