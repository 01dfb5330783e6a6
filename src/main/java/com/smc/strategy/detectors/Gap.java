package com.smc.strategy.detectors;

import com.smc.market.Horizon;
import com.smc.strategy.Direction;
import com.smc.strategy.ScoreMath;

public record Gap(
		Horizon horizon,
		Direction direction,
		double upper,
		double lower,
		long createdAt,
		int sourceIndex,
		boolean filled,
		Long filledAt) {

	public Gap {
		if (upper < lower) {
			throw new IllegalArgumentException("gap upper " + upper + " below lower " + lower);
		}
	}

	public static Gap open(Horizon horizon, Direction direction, double upper, double lower, long createdAt,
			int sourceIndex) {
		return new Gap(horizon, direction, upper, lower, createdAt, sourceIndex, false, null);
	}

	public double equilibrium() {
		return ScoreMath.midpoint(upper, lower);
	}

	public double size() {
		return upper - lower;
	}

	public Gap markFilled(long time) {
		if (filled) {
			return this;
		}
		return new Gap(horizon, direction, upper, lower, createdAt, sourceIndex, true, time);
	}

	public Key key() {
		return new Key(createdAt, direction);
	}

	public record Key(long createdAt, Direction direction) {
	}
}
