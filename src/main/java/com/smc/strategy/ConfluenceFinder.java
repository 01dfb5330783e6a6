package com.smc.strategy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class ConfluenceFinder {

	private ConfluenceFinder() {
	}

	/**
	 * Clusters of overlapping candidates from at least two horizons, nearest to
	 * price first. Each (horizon, kind) contributes at most once per cluster.
	 */
	public static List<ConfluenceZone> find(List<ConfluenceCandidate> candidates, double price,
			SmcProperties.ConfluenceSettings settings) {
		List<ConfluenceCandidate> ordered = new ArrayList<>(candidates);
		ordered.sort(Comparator.comparingDouble(candidate -> candidate.distanceTo(price)));
		Set<Set<ConfluenceCandidate>> seen = new HashSet<>();
		List<ConfluenceZone> zones = new ArrayList<>();
		for (int i = 0; i < ordered.size(); i++) {
			for (int j = i + 1; j < ordered.size(); j++) {
				ConfluenceCandidate first = ordered.get(i);
				ConfluenceCandidate second = ordered.get(j);
				if (first.horizon() == second.horizon() || first.direction() != second.direction()) {
					continue;
				}
				if (!ScoreMath.overlaps(first.upper(), first.lower(), second.upper(), second.lower())) {
					continue;
				}
				Set<ConfluenceCandidate> members = new LinkedHashSet<>(List.of(first, second));
				Set<ConfluenceSource> sources = new LinkedHashSet<>(List.of(first.source(), second.source()));
				double upper = Math.min(first.upper(), second.upper());
				double lower = Math.max(first.lower(), second.lower());
				for (ConfluenceCandidate other : ordered) {
					if (members.contains(other) || sources.contains(other.source())
							|| other.direction() != first.direction()) {
						continue;
					}
					if (ScoreMath.overlaps(upper, lower, other.upper(), other.lower())) {
						members.add(other);
						sources.add(other.source());
						upper = Math.min(upper, other.upper());
						lower = Math.max(lower, other.lower());
					}
				}
				if (seen.add(Set.copyOf(members))) {
					zones.add(new ConfluenceZone(first.direction(), upper, lower, sources,
							confidence(sources.size(), settings)));
				}
			}
		}
		zones.sort(Comparator.comparingDouble((ConfluenceZone zone) -> ScoreMath.distanceToRange(price, zone.upper(),
				zone.lower()))
				.thenComparing(Comparator.comparingInt(ConfluenceZone::sourceCount).reversed()));
		return zones;
	}

	static double confidence(int sourceCount, SmcProperties.ConfluenceSettings settings) {
		double raw = settings.baseConfidence() + settings.stepPerSource() * Math.max(0, sourceCount - 2);
		return ScoreMath.clamp(raw, 0.0, settings.maxConfidence());
	}
}
