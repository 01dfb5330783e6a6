package com.smc.strategy;

import java.util.Set;

public record EntryCandidate(
		SetupType setup,
		Direction direction,
		double upper,
		double lower,
		Set<ConfluenceSource> sources,
		double confidence) {

	public EntryCandidate {
		sources = Set.copyOf(sources);
	}

	public static EntryCandidate of(ConfluenceZone zone) {
		return new EntryCandidate(SetupType.CONFLUENCE, zone.direction(), zone.upper(), zone.lower(), zone.sources(),
				zone.confidence());
	}

	public static EntryCandidate fallback(ConfluenceCandidate candidate, double confidence) {
		return new EntryCandidate(SetupType.of(candidate.kind()), candidate.direction(), candidate.upper(),
				candidate.lower(), Set.of(candidate.source()), confidence);
	}

	public double entryLevel() {
		return ScoreMath.midpoint(upper, lower);
	}

	public double range() {
		return upper - lower;
	}

	public int sourceCount() {
		return sources.size();
	}
}
