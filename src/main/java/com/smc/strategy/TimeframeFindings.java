package com.smc.strategy;

import java.util.List;

import com.smc.market.Horizon;
import com.smc.strategy.detectors.Gap;
import com.smc.strategy.detectors.LiquidityFindings;
import com.smc.strategy.detectors.Structure;
import com.smc.strategy.detectors.ZoneFindings;

public record TimeframeFindings(
		Horizon horizon,
		int candleCount,
		double lastClose,
		long lastCloseTime,
		List<Gap> gaps,
		ZoneFindings zones,
		Structure structure,
		LiquidityFindings liquidity) {

	public TimeframeFindings {
		gaps = List.copyOf(gaps);
	}

	public TimeframeFindings withGaps(List<Gap> current) {
		return new TimeframeFindings(horizon, candleCount, lastClose, lastCloseTime, current, zones, structure,
				liquidity);
	}

	public Trend trend() {
		return structure.trend();
	}

	public List<Gap> unfilledGaps() {
		return gaps.stream().filter(gap -> !gap.filled()).toList();
	}

	public List<Gap> unfilledGaps(Direction direction) {
		return gaps.stream()
				.filter(gap -> !gap.filled() && gap.direction() == direction)
				.toList();
	}
}
