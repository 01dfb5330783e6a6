package com.smc.strategy;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.smc.market.Horizon;
import com.smc.strategy.detectors.Sweep;
import com.smc.strategy.detectors.ZoneFindings;

public record CoordinatorResult(
		String symbol,
		BiasDecision bias,
		Map<Horizon, Trend> trends,
		List<ConfluenceZone> confluenceZones,
		EntryCandidate candidate,
		PriceLocation location,
		Map<Horizon, TimeframeFindings> snapshot,
		List<Sweep> recentSweeps,
		List<ZoneFindings.Retest> candidateRetests) {

	public CoordinatorResult {
		trends = Map.copyOf(trends);
		confluenceZones = List.copyOf(confluenceZones);
		snapshot = Map.copyOf(snapshot);
		recentSweeps = List.copyOf(recentSweeps);
		candidateRetests = List.copyOf(candidateRetests);
	}

	public Optional<EntryCandidate> entryCandidate() {
		return Optional.ofNullable(candidate);
	}
}
