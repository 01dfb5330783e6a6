package com.smc.strategy.cache;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.smc.market.Horizon;
import com.smc.strategy.StrategyFixtures;
import com.smc.strategy.TimeframeFindings;
import com.smc.strategy.Trend;

class FindingsCacheTest {

	private static final CacheKey KEY = new CacheKey("EURUSD", Horizon.H4);
	private static final Instant T0 = Instant.parse("2024-01-10T12:00:00Z");

	@Test
	void entryIsReusedUntilCadenceElapses() {
		FindingsCache cache = new FindingsCache();
		assertTrue(cache.refreshDue(KEY, T0));

		cache.put(KEY, findings(), T0, Duration.ofMinutes(1));

		assertFalse(cache.refreshDue(KEY, T0.plusSeconds(30)));
		assertTrue(cache.refreshDue(KEY, T0.plusSeconds(60)));
	}

	@Test
	void staleEntryIsServedOnlyWithinMaxStaleness() {
		FindingsCache cache = new FindingsCache();
		cache.put(KEY, findings(), T0, Duration.ofMinutes(1));

		assertTrue(cache.read(KEY, T0.plus(Duration.ofMinutes(4)), Duration.ofMinutes(5)).isPresent());
		assertTrue(cache.read(KEY, T0.plus(Duration.ofMinutes(6)), Duration.ofMinutes(5)).isEmpty());
	}

	@Test
	void evictedEntryIsUnavailable() {
		FindingsCache cache = new FindingsCache();
		cache.put(KEY, findings(), T0, Duration.ofMinutes(1));
		cache.evict(KEY);
		assertTrue(cache.read(KEY, T0, Duration.ofHours(1)).isEmpty());
	}

	private static TimeframeFindings findings() {
		return StrategyFixtures.findings(Horizon.H4, Trend.UPTREND, List.of(), List.of(), List.of());
	}
}
