package com.smc.strategy.cache;

import java.time.Duration;
import java.time.Instant;

public record CacheEntry<T>(T value, Instant fetchedAt, Duration ttl) {

	public Duration age(Instant now) {
		return Duration.between(fetchedAt, now);
	}

	public boolean refreshDue(Instant now) {
		return age(now).compareTo(ttl) >= 0;
	}

	public boolean staleBeyond(Instant now, Duration maxStaleness) {
		return age(now).compareTo(maxStaleness) > 0;
	}
}
