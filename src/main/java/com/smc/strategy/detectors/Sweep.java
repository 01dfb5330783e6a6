package com.smc.strategy.detectors;

import com.smc.market.Horizon;
import com.smc.strategy.Direction;

public record Sweep(
		Horizon horizon,
		LiquidityLevel.Side side,
		double levelPrice,
		double extreme,
		long breachTime,
		long confirmTime) {

	public Direction direction() {
		return side.reversal();
	}
}
