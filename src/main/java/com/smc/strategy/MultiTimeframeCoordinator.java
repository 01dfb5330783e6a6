package com.smc.strategy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.smc.market.Horizon;
import com.smc.strategy.cache.SweepLog;
import com.smc.strategy.detectors.Gap;
import com.smc.strategy.detectors.ReversalZone;
import com.smc.strategy.detectors.Structure;
import com.smc.strategy.detectors.StructurePoint;
import com.smc.strategy.detectors.Sweep;
import com.smc.strategy.detectors.ZoneFindings;

@Component
public class MultiTimeframeCoordinator {

	private final SmcProperties properties;
	private final SweepLog sweepLog;

	public MultiTimeframeCoordinator(SmcProperties properties, SweepLog sweepLog) {
		this.properties = properties;
		this.sweepLog = sweepLog;
	}

	public CoordinatorResult coordinate(String symbol, Map<Horizon, TimeframeFindings> snapshot, double currentPrice,
			Instant now) {
		Map<Horizon, Trend> trends = new EnumMap<>(Horizon.class);
		snapshot.forEach((horizon, findings) -> trends.put(horizon, findings.trend()));
		BiasDecision bias = BiasResolver.resolve(trends.get(Horizon.widest()), trends.get(Horizon.secondWidest()));
		PriceLocation location = locate(snapshot.get(Horizon.widest()), currentPrice);
		long sweepCutoff = now.minus(properties.liquidity().sweepRecency()).toEpochMilli();
		List<Sweep> recentSweeps = sweepLog.since(symbol, sweepCutoff);

		Direction direction = bias.bias().direction();
		if (direction == null) {
			return new CoordinatorResult(symbol, bias, trends, List.of(), null, location, snapshot, recentSweeps,
					List.of());
		}
		List<ConfluenceCandidate> candidates = new ArrayList<>();
		for (Horizon horizon : Horizon.values()) {
			TimeframeFindings findings = snapshot.get(horizon);
			if (findings != null) {
				candidates.addAll(nearest(candidatesFor(findings, direction), currentPrice,
						properties.confluence().maxCandidatesPerHorizon()));
			}
		}
		List<ConfluenceZone> zones = ConfluenceFinder.find(candidates, currentPrice, properties.confluence());
		EntryCandidate candidate = zones.isEmpty()
				? fallback(snapshot.get(Horizon.secondWidest()), direction, currentPrice).orElse(null)
				: EntryCandidate.of(zones.get(0));
		return new CoordinatorResult(symbol, bias, trends, zones, candidate, location, snapshot, recentSweeps,
				retestsOf(candidate, snapshot));
	}

	/**
	 * Re-tests on the latest candle of the zones that contributed to the
	 * candidate, matched by horizon, zone kind, direction and overlap.
	 */
	static List<ZoneFindings.Retest> retestsOf(EntryCandidate candidate, Map<Horizon, TimeframeFindings> snapshot) {
		if (candidate == null) {
			return List.of();
		}
		List<ZoneFindings.Retest> retests = new ArrayList<>();
		for (ConfluenceSource source : candidate.sources()) {
			TimeframeFindings findings = snapshot.get(source.horizon());
			if (source.kind() == SourceKind.GAP || findings == null) {
				continue;
			}
			for (ZoneFindings.Retest retest : findings.zones().retests()) {
				ReversalZone zone = retest.zone();
				if (zone.kind() == source.kind()
						&& zone.direction() == candidate.direction()
						&& ScoreMath.overlaps(zone.upper(), zone.lower(), candidate.upper(), candidate.lower())) {
					retests.add(retest);
				}
			}
		}
		return retests;
	}

	static List<ConfluenceCandidate> candidatesFor(TimeframeFindings findings, Direction direction) {
		List<ConfluenceCandidate> candidates = new ArrayList<>();
		for (Gap gap : findings.unfilledGaps(direction)) {
			candidates.add(ConfluenceCandidate.of(gap));
		}
		for (ReversalZone zone : findings.zones().active(direction)) {
			candidates.add(ConfluenceCandidate.of(zone));
		}
		return candidates;
	}

	private Optional<EntryCandidate> fallback(TimeframeFindings findings, Direction direction, double currentPrice) {
		if (findings == null) {
			return Optional.empty();
		}
		return candidatesFor(findings, direction).stream()
				.min(Comparator.comparingDouble(candidate -> candidate.distanceTo(currentPrice)))
				.map(candidate -> EntryCandidate.fallback(candidate, properties.confluence().fallbackConfidence()));
	}

	private static List<ConfluenceCandidate> nearest(List<ConfluenceCandidate> candidates, double price, int limit) {
		return candidates.stream()
				.sorted(Comparator.comparingDouble(candidate -> candidate.distanceTo(price)))
				.limit(limit)
				.toList();
	}

	static PriceLocation locate(TimeframeFindings widest, double price) {
		if (widest == null) {
			return PriceLocation.UNKNOWN;
		}
		Structure structure = widest.structure();
		Optional<StructurePoint> high = structure.lastSwingHigh();
		Optional<StructurePoint> low = structure.lastSwingLow();
		if (high.isEmpty() || low.isEmpty() || high.get().price() <= low.get().price()) {
			return PriceLocation.UNKNOWN;
		}
		double equilibrium = ScoreMath.midpoint(high.get().price(), low.get().price());
		if (price > equilibrium) {
			return PriceLocation.PREMIUM;
		}
		if (price < equilibrium) {
			return PriceLocation.DISCOUNT;
		}
		return PriceLocation.EQUILIBRIUM;
	}
}
