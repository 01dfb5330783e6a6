package com.smc.strategy.cache;

import com.smc.market.Horizon;

public record CacheKey(String symbol, Horizon horizon) {
}
