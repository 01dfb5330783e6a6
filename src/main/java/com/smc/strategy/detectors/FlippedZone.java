package com.smc.strategy.detectors;

import com.smc.market.Horizon;
import com.smc.strategy.Direction;
import com.smc.strategy.SourceKind;

public record FlippedZone(Zone origin, long flippedAt) implements ReversalZone {

	@Override
	public Horizon horizon() {
		return origin.horizon();
	}

	@Override
	public Direction direction() {
		return origin.direction().opposite();
	}

	@Override
	public double upper() {
		return origin.upper();
	}

	@Override
	public double lower() {
		return origin.lower();
	}

	@Override
	public long formedAt() {
		return flippedAt;
	}

	@Override
	public boolean active() {
		return true;
	}

	@Override
	public SourceKind kind() {
		return SourceKind.FLIPPED_ZONE;
	}
}
