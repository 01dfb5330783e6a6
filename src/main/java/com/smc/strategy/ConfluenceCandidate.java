package com.smc.strategy;

import com.smc.market.Horizon;
import com.smc.strategy.detectors.Gap;
import com.smc.strategy.detectors.ReversalZone;

public record ConfluenceCandidate(
		Horizon horizon,
		SourceKind kind,
		Direction direction,
		double upper,
		double lower,
		long formedAt) {

	public static ConfluenceCandidate of(Gap gap) {
		return new ConfluenceCandidate(gap.horizon(), SourceKind.GAP, gap.direction(), gap.upper(), gap.lower(),
				gap.createdAt());
	}

	public static ConfluenceCandidate of(ReversalZone zone) {
		return new ConfluenceCandidate(zone.horizon(), zone.kind(), zone.direction(), zone.upper(), zone.lower(),
				zone.formedAt());
	}

	public ConfluenceSource source() {
		return new ConfluenceSource(horizon, kind);
	}

	public double distanceTo(double price) {
		return ScoreMath.distanceToRange(price, upper, lower);
	}
}
