package com.smc.strategy;

import static com.smc.strategy.StrategyFixtures.candle;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.smc.market.Candle;
import com.smc.market.Horizon;
import com.smc.market.InvalidCandleSeriesException;
import com.smc.strategy.cache.CacheKey;
import com.smc.strategy.cache.GapLedger;
import com.smc.strategy.cache.SweepLog;

class TimeframeAnalyzerTest {

	private static final Instant NOW = Instant.parse("2024-01-10T12:00:00Z");

	private final GapLedger gapLedger = new GapLedger(Duration.ofHours(24), 100);
	private final TimeframeAnalyzer analyzer = new TimeframeAnalyzer(StrategyFixtures.properties(), gapLedger,
			new SweepLog(50));

	@Test
	void findingsCarryLatestCloseAndLedgerGaps() {
		List<Candle> candles = List.of(
				candle(111, 112, 110, 111, 1_000L),
				candle(109, 111, 104, 106, 2_000L),
				candle(104, 105, 103, 104, 3_000L));

		TimeframeFindings findings = analyzer.analyze("EURUSD", Horizon.H1, candles, NOW);

		assertEquals(Horizon.H1, findings.horizon());
		assertEquals(3, findings.candleCount());
		assertEquals(104.0, findings.lastClose());
		assertEquals(3_000L, findings.lastCloseTime());
		assertEquals(1, findings.unfilledGaps(Direction.BULLISH).size());
		assertEquals(findings.gaps(), gapLedger.snapshot(new CacheKey("EURUSD", Horizon.H1)));
		assertEquals(Trend.RANGING, findings.trend());
	}

	@Test
	void corruptSeriesIsRejected() {
		List<Candle> candles = List.of(candle(1, 2, 0.5, 1, 2_000L), candle(1, 2, 0.5, 1, 1_000L));
		assertThrows(InvalidCandleSeriesException.class,
				() -> analyzer.analyze("EURUSD", Horizon.M5, candles, NOW));
	}
}
