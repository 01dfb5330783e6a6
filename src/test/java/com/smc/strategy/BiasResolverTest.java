package com.smc.strategy;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class BiasResolverTest {

	@Test
	void coversEveryTrendCombination() {
		Trend[] trends = {Trend.UPTREND, Trend.DOWNTREND, Trend.RANGING};
		Object[][] expected = {
				{Bias.BULLISH, BiasTier.AGREEMENT}, {Bias.BULLISH, BiasTier.WIDEST_PRIORITY},
				{Bias.BULLISH, BiasTier.WIDEST_PRIORITY},
				{Bias.BEARISH, BiasTier.WIDEST_PRIORITY}, {Bias.BEARISH, BiasTier.AGREEMENT},
				{Bias.BEARISH, BiasTier.WIDEST_PRIORITY},
				{Bias.BULLISH, BiasTier.SECOND_FALLBACK}, {Bias.BEARISH, BiasTier.SECOND_FALLBACK},
				{Bias.NEUTRAL, BiasTier.NONE}
		};
		int row = 0;
		for (Trend widest : trends) {
			for (Trend second : trends) {
				BiasDecision decision = BiasResolver.resolve(widest, second);
				assertEquals(expected[row][0], decision.bias(), widest + "/" + second);
				assertEquals(expected[row][1], decision.tier(), widest + "/" + second);
				row++;
			}
		}
	}

	@Test
	void unavailableHorizonCountsAsNoTrend() {
		assertEquals(BiasTier.SECOND_FALLBACK, BiasResolver.resolve(null, Trend.DOWNTREND).tier());
		assertEquals(Bias.BEARISH, BiasResolver.resolve(null, Trend.DOWNTREND).bias());
		assertEquals(BiasTier.WIDEST_PRIORITY, BiasResolver.resolve(Trend.UPTREND, null).tier());
		assertEquals(Bias.NEUTRAL, BiasResolver.resolve(null, null).bias());
	}
}
