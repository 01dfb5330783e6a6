package com.smc.strategy;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.smc.market.Candle;
import com.smc.market.CandleSeriesValidator;
import com.smc.market.Horizon;
import com.smc.strategy.cache.CacheKey;
import com.smc.strategy.cache.GapLedger;
import com.smc.strategy.cache.SweepLog;
import com.smc.strategy.detectors.Gap;
import com.smc.strategy.detectors.GapDetector;
import com.smc.strategy.detectors.LiquidityFindings;
import com.smc.strategy.detectors.ReversalZoneDetector;
import com.smc.strategy.detectors.StopHuntAnalyzer;
import com.smc.strategy.detectors.Structure;
import com.smc.strategy.detectors.StructureAnalyzer;
import com.smc.strategy.detectors.ZoneFindings;

/**
 * Runs every detector over one horizon's series and folds the results into the
 * symbol's gap ledger and sweep log.
 */
@Component
public class TimeframeAnalyzer {

	private final SmcProperties properties;
	private final GapLedger gapLedger;
	private final SweepLog sweepLog;

	public TimeframeAnalyzer(SmcProperties properties, GapLedger gapLedger, SweepLog sweepLog) {
		this.properties = properties;
		this.gapLedger = gapLedger;
		this.sweepLog = sweepLog;
	}

	public TimeframeFindings analyze(String symbol, Horizon horizon, List<Candle> candles, Instant now) {
		CandleSeriesValidator.validate(horizon, candles);
		if (candles.isEmpty()) {
			throw new IllegalArgumentException("no candles for " + symbol + " " + horizon);
		}
		double pointSize = properties.pointSize(symbol);

		List<Gap> detected = GapDetector.detect(horizon, candles, properties.gap().minSizePoints() * pointSize);
		List<Gap> gaps = gapLedger.merge(new CacheKey(symbol, horizon), detected, candles, now);
		gapLedger.scanFills(symbol, horizon, candles, now);

		SmcProperties.ZoneSettings zoneSettings = properties.zone();
		ZoneFindings zones = ReversalZoneDetector.detect(horizon, candles, new ReversalZoneDetector.Params(
				zoneSettings.minRunLength(),
				zoneSettings.minMovePoints() * pointSize,
				zoneSettings.originLookback(),
				pointSize));

		Structure structure = StructureAnalyzer.analyze(candles, properties.structure().swingWindow());

		SmcProperties.LiquiditySettings liquiditySettings = properties.liquidity();
		LiquidityFindings liquidity = StopHuntAnalyzer.analyze(horizon, candles, new StopHuntAnalyzer.Params(
				liquiditySettings.lookback(),
				liquiditySettings.swingWindow(),
				liquiditySettings.touchTolerancePoints() * pointSize,
				liquiditySettings.sweepTolerancePoints() * pointSize,
				liquiditySettings.maxLevelsPerSide()));
		sweepLog.record(symbol, liquidity.sweeps());

		Candle last = candles.get(candles.size() - 1);
		return new TimeframeFindings(horizon, candles.size(), last.close(), last.closeTime(), gaps, zones, structure,
				liquidity);
	}

	/**
	 * Replaces the gaps of each horizon with the ledger's current view, picking
	 * up fills recorded from narrower horizons since the findings were cached.
	 */
	public Map<Horizon, TimeframeFindings> withTrackedGaps(String symbol, Map<Horizon, TimeframeFindings> snapshot) {
		Map<Horizon, TimeframeFindings> current = new EnumMap<>(Horizon.class);
		snapshot.forEach((horizon, findings) -> current.put(horizon,
				gapLedger.tracked(new CacheKey(symbol, horizon)).map(findings::withGaps).orElse(findings)));
		return current;
	}
}
