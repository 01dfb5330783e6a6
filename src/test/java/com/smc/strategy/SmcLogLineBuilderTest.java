package com.smc.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

import com.smc.market.Horizon;

class SmcLogLineBuilderTest {

	@Test
	void rejectedLineUsesNaForMissingValues() {
		String line = SmcLogLineBuilder.build(new SmcLogV1.SignalRejectedLogDto("EURUSD", Bias.BULLISH,
				SignalDecision.REASON_RR_BELOW_MIN, 1.1, 1.5, null));

		assertEquals("EVENT=SIGNAL_REJECTED symbol=EURUSD bias=BULLISH reason=RR_BELOW_MIN price=1.1 rr=1.5"
				+ " confidence=NA", line);
	}

	@Test
	void unavailableLineCarriesHorizonAndCounts() {
		String line = SmcLogLineBuilder.build(new SmcLogV1.TimeframeUnavailableLogDto("GBPUSD", Horizon.M15,
				"INSUFFICIENT_DATA", 40, 100));

		assertThat(line).startsWith("EVENT=TIMEFRAME_UNAVAILABLE")
				.contains(" tf=M15")
				.contains(" reason=INSUFFICIENT_DATA")
				.contains(" received=40")
				.contains(" requested=100");
	}

	@Test
	void biasChangedLineNamesBothBiases() {
		String line = SmcLogLineBuilder.build(new SmcLogV1.BiasChangedLogDto("XAUUSD", Bias.BEARISH, Bias.BULLISH,
				BiasTier.WIDEST_PRIORITY));

		assertEquals("EVENT=BIAS_CHANGED symbol=XAUUSD previous=BEARISH current=BULLISH tier=WIDEST_PRIORITY", line);
	}
}
