package com.smc.strategy.detectors;

import com.smc.market.Candle;
import com.smc.market.Horizon;
import com.smc.strategy.Direction;
import com.smc.strategy.SourceKind;

public record Zone(
		Horizon horizon,
		Direction direction,
		double upper,
		double lower,
		long createdAt,
		double strength,
		int sourceIndex,
		boolean valid) implements ReversalZone {

	public Zone {
		if (upper < lower) {
			throw new IllegalArgumentException("zone upper " + upper + " below lower " + lower);
		}
	}

	@Override
	public long formedAt() {
		return createdAt;
	}

	@Override
	public boolean active() {
		return valid;
	}

	@Override
	public SourceKind kind() {
		return SourceKind.ZONE;
	}

	public boolean invalidatedBy(Candle candle) {
		if (direction == Direction.BULLISH) {
			return candle.close() < lower;
		}
		return candle.close() > upper;
	}

	/**
	 * Invalidates this zone and produces its flipped counterpart. A zone flips at
	 * most once.
	 */
	public Flip flip(long flippedAt) {
		if (!valid) {
			throw new IllegalStateException("zone created at " + createdAt + " already invalidated");
		}
		Zone invalidated = new Zone(horizon, direction, upper, lower, createdAt, strength, sourceIndex, false);
		return new Flip(invalidated, new FlippedZone(invalidated, flippedAt));
	}

	public record Flip(Zone invalidated, FlippedZone flipped) {
	}
}
