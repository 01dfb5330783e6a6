package com.smc.strategy.detectors;

import com.smc.market.Horizon;
import com.smc.strategy.Direction;
import com.smc.strategy.ScoreMath;
import com.smc.strategy.SourceKind;

public sealed interface ReversalZone permits Zone, FlippedZone {

	Horizon horizon();

	Direction direction();

	double upper();

	double lower();

	long formedAt();

	boolean active();

	SourceKind kind();

	default double entryLevel() {
		return ScoreMath.midpoint(upper(), lower());
	}

	default double range() {
		return upper() - lower();
	}
}
