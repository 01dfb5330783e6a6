package com.smc.strategy.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.smc.strategy.TimeframeFindings;

/**
 * Latest findings per symbol and horizon. Reads go through {@link #read} so an
 * entry older than its maximum staleness is never returned.
 */
public class FindingsCache {

	private final Map<CacheKey, CacheEntry<TimeframeFindings>> entries = new ConcurrentHashMap<>();

	public void put(CacheKey key, TimeframeFindings findings, Instant fetchedAt, Duration ttl) {
		entries.put(key, new CacheEntry<>(findings, fetchedAt, ttl));
	}

	public Optional<TimeframeFindings> read(CacheKey key, Instant now, Duration maxStaleness) {
		CacheEntry<TimeframeFindings> entry = entries.get(key);
		if (entry == null || entry.staleBeyond(now, maxStaleness)) {
			return Optional.empty();
		}
		return Optional.of(entry.value());
	}

	public boolean refreshDue(CacheKey key, Instant now) {
		CacheEntry<TimeframeFindings> entry = entries.get(key);
		return entry == null || entry.refreshDue(now);
	}

	public Optional<CacheEntry<TimeframeFindings>> entry(CacheKey key) {
		return Optional.ofNullable(entries.get(key));
	}

	public void evict(CacheKey key) {
		entries.remove(key);
	}
}
