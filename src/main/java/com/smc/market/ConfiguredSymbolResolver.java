package com.smc.market;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.smc.config.MarketProperties;

public class ConfiguredSymbolResolver implements SymbolResolver {

	private final Map<String, String> brokerSymbols;

	public ConfiguredSymbolResolver(MarketProperties properties) {
		this.brokerSymbols = properties.brokerSymbols();
	}

	@Override
	public Optional<String> resolve(String symbol) {
		if (symbol == null || symbol.isBlank()) {
			return Optional.empty();
		}
		String normalized = symbol.trim().toUpperCase(Locale.ROOT);
		String mapped = brokerSymbols.get(normalized);
		if (mapped != null && !mapped.isBlank()) {
			return Optional.of(mapped);
		}
		return Optional.of(normalized);
	}
}
