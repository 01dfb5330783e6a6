package com.smc.strategy;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class BiasChangeTracker {

	private final Map<String, Bias> lastBias = new ConcurrentHashMap<>();

	/**
	 * Records the bias and returns the previous one when it differs. The first
	 * observation for a symbol is not a change.
	 */
	public Optional<Bias> update(String symbol, Bias bias) {
		Bias previous = lastBias.put(symbol, bias);
		if (previous == null || previous == bias) {
			return Optional.empty();
		}
		return Optional.of(previous);
	}

	public Optional<Bias> last(String symbol) {
		return Optional.ofNullable(lastBias.get(symbol));
	}
}
