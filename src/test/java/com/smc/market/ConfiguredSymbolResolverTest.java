package com.smc.market;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.smc.config.MarketProperties;

class ConfiguredSymbolResolverTest {

	private final ConfiguredSymbolResolver resolver = new ConfiguredSymbolResolver(
			new MarketProperties(null, null, Map.of(), Map.of("XAUUSD", "GOLD"), null));

	@Test
	void mapsConfiguredSymbol() {
		assertEquals(Optional.of("GOLD"), resolver.resolve("xauusd"));
	}

	@Test
	void fallsBackToLogicalSymbol() {
		assertEquals(Optional.of("EURUSD"), resolver.resolve(" EURUSD "));
	}

	@Test
	void blankSymbolIsUnresolvable() {
		assertTrue(resolver.resolve(" ").isEmpty());
	}
}
