package com.smc.strategy;

import java.util.Set;

public record ConfluenceZone(
		Direction direction,
		double upper,
		double lower,
		Set<ConfluenceSource> sources,
		double confidence) {

	public ConfluenceZone {
		if (upper < lower) {
			throw new IllegalArgumentException("confluence upper " + upper + " below lower " + lower);
		}
		sources = Set.copyOf(sources);
	}

	public double entryLevel() {
		return ScoreMath.midpoint(upper, lower);
	}

	public int sourceCount() {
		return sources.size();
	}
}
