package com.smc.strategy;

import static com.smc.strategy.StrategyFixtures.findings;
import static com.smc.strategy.StrategyFixtures.gap;
import static com.smc.strategy.StrategyFixtures.level;
import static com.smc.strategy.StrategyFixtures.zone;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.smc.market.Horizon;
import com.smc.strategy.detectors.LiquidityLevel;
import com.smc.strategy.detectors.Sweep;
import com.smc.strategy.detectors.ZoneFindings;

class SignalSynthesizerTest {

	private static final Instant NOW = Instant.parse("2024-01-10T12:00:00Z");

	private final SignalSynthesizer synthesizer = new SignalSynthesizer(StrategyFixtures.properties());

	@Test
	void rewardRiskExactlyAtMinimumIsEmitted() {
		SignalDecision decision = synthesizer.synthesize(bullishResult(105.0, List.of()), 103.0, NOW);

		assertTrue(decision.accepted());
		SignalProposal proposal = decision.proposal();
		assertEquals(Direction.BULLISH, proposal.direction());
		assertEquals(OrderKind.LIMIT_BELOW, proposal.orderKind());
		assertEquals(101.0, proposal.entry());
		assertEquals(99.0, proposal.stop());
		assertEquals(105.0, proposal.target());
		assertEquals(2.0, proposal.rewardRisk());
		assertEquals(SetupType.CONFLUENCE, proposal.setup());
		assertEquals(NOW.toEpochMilli(), proposal.timestamp());
		assertEquals(Trend.UPTREND, proposal.timeframeBias().get(Horizon.H4));
		assertThat(proposal.rationale()).contains("BIAS_AGREEMENT", "SETUP_CONFLUENCE", "H1_ZONE", "H4_GAP",
				"TARGET_LIQUIDITY");
	}

	@Test
	void rewardRiskJustBelowMinimumIsRejected() {
		SignalDecision decision = synthesizer.synthesize(bullishResult(104.998, List.of()), 103.0, NOW);

		assertFalse(decision.accepted());
		assertEquals(SignalDecision.REASON_RR_BELOW_MIN, decision.reason());
		assertEquals(1.999, decision.rewardRisk(), 1e-9);
	}

	@Test
	void rewardRiskAtMinimumWithDecimalPricesIsEmitted() {
		SmcProperties fx = new SmcProperties(List.of("EURUSD"), 0.0001, Map.of(), Map.of(), null, null, null, null,
				null, null, null);
		EntryCandidate candidate = new EntryCandidate(SetupType.CONFLUENCE, Direction.BULLISH, 1.35, 1.25,
				Set.of(new ConfluenceSource(Horizon.H4, SourceKind.GAP), new ConfluenceSource(Horizon.H1, SourceKind.ZONE)),
				0.7);
		TimeframeFindings h4 = findings(Horizon.H4, Trend.UPTREND, List.of(), List.of(),
				List.of(level(1.42, LiquidityLevel.Side.UPPER)));
		CoordinatorResult result = new CoordinatorResult("EURUSD", BiasResolver.resolve(Trend.UPTREND, Trend.UPTREND),
				Map.of(Horizon.H4, Trend.UPTREND), List.of(), candidate, PriceLocation.UNKNOWN, Map.of(Horizon.H4, h4),
				List.of(), List.of());

		SignalDecision decision = new SignalSynthesizer(fx).synthesize(result, 1.36, NOW);

		assertTrue(decision.accepted(), () -> "rejected with " + decision.reason() + " rr=" + decision.rewardRisk());
		assertEquals(1.30, decision.proposal().entry(), 1e-12);
		assertEquals(1.24, decision.proposal().stop(), 1e-12);
		assertEquals(2.0, decision.proposal().rewardRisk(), 1e-9);
	}

	@Test
	void confidenceCombinesTierConfluenceAndSweep() {
		SignalDecision plain = synthesizer.synthesize(bullishResult(105.0, List.of()), 103.0, NOW);
		assertEquals(0.5 * 0.9 + 0.3 * 0.5, plain.confidence(), 1e-9);

		Sweep lowerSweep = new Sweep(Horizon.M15, LiquidityLevel.Side.LOWER, 98.0, 97.0, 1L, 1L);
		SignalDecision swept = synthesizer.synthesize(bullishResult(105.0, List.of(lowerSweep)), 103.0, NOW);
		assertEquals(0.5 * 0.9 + 0.3 * 0.5 + 0.2, swept.confidence(), 1e-9);
		assertThat(swept.proposal().rationale()).contains("SWEEP_CONFIRMED");
	}

	@Test
	void retestOfContributingZoneRaisesConfidence() {
		ZoneFindings.Retest retest = new ZoneFindings.Retest(zone(Horizon.H1, Direction.BULLISH, 103, 101), 20L);

		SignalDecision decision = synthesizer.synthesize(bullishResult(105.0, List.of(), List.of(retest)), 103.0, NOW);

		assertTrue(decision.accepted());
		assertEquals(0.5 * 0.9 + 0.3 * 0.5 + 0.1, decision.confidence(), 1e-9);
		assertThat(decision.proposal().rationale()).contains("H1_ZONE_RETEST");
	}

	@Test
	void neutralBiasIsRejected() {
		CoordinatorResult result = new CoordinatorResult("EURUSD", BiasResolver.resolve(Trend.RANGING, Trend.RANGING),
				Map.of(), List.of(), null, PriceLocation.UNKNOWN, Map.of(), List.of(), List.of());
		assertEquals(SignalDecision.REASON_NEUTRAL_BIAS, synthesizer.synthesize(result, 100.0, NOW).reason());
	}

	@Test
	void missingCandidateIsRejected() {
		CoordinatorResult result = new CoordinatorResult("EURUSD", BiasResolver.resolve(Trend.UPTREND, Trend.UPTREND),
				Map.of(), List.of(), null, PriceLocation.UNKNOWN, Map.of(), List.of(), List.of());
		SignalDecision decision = synthesizer.synthesize(result, 100.0, NOW);
		assertEquals(SignalDecision.REASON_NO_CANDIDATE, decision.reason());
		assertNull(decision.proposal());
	}

	@Test
	void targetMustLieBeyondEntry() {
		SignalDecision decision = synthesizer.synthesize(bullishResult(100.5, List.of()), 103.0, NOW);
		assertEquals(SignalDecision.REASON_NO_TARGET, decision.reason());
	}

	@Test
	void nearestOpposingGapEdgeIsPreferredOverFartherLiquidity() {
		TimeframeFindings h4 = findings(Horizon.H4, Trend.UPTREND,
				List.of(gap(Horizon.H4, Direction.BEARISH, 110, 106)), List.of(), List.of(level(112, LiquidityLevel.Side.UPPER)));
		CoordinatorResult result = new CoordinatorResult("EURUSD", BiasResolver.resolve(Trend.UPTREND, Trend.UPTREND),
				Map.of(Horizon.H4, Trend.UPTREND), List.of(), candidate(), PriceLocation.DISCOUNT, Map.of(Horizon.H4, h4),
				List.of(), List.of());

		SignalProposal proposal = synthesizer.synthesize(result, 100.0, NOW).proposal();

		assertEquals(106.0, proposal.target());
		assertEquals(OrderKind.STOP_ABOVE, proposal.orderKind());
		assertThat(proposal.rationale()).contains("TARGET_GAP", "LOCATION_DISCOUNT");
	}

	@Test
	void minimumConfidenceFiltersWeakSignals() {
		SmcProperties strict = new SmcProperties(List.of("EURUSD"), 1.0, Map.of(), Map.of(), null, null, null, null,
				null, new SmcProperties.SignalSettings(null, null, null, null, null, null, null, null, null, null,
						null, 0.9),
				null);
		SignalDecision decision = new SignalSynthesizer(strict).synthesize(bullishResult(105.0, List.of()), 103.0, NOW);
		assertEquals(SignalDecision.REASON_LOW_CONFIDENCE, decision.reason());
		assertEquals(0.6, decision.confidence(), 1e-9);
	}

	@Test
	void orderKindFollowsPriceRelativeToEntry() {
		assertEquals(OrderKind.LIMIT_BELOW, SignalSynthesizer.orderKind(Direction.BULLISH, 102, 101));
		assertEquals(OrderKind.STOP_ABOVE, SignalSynthesizer.orderKind(Direction.BULLISH, 100, 101));
		assertEquals(OrderKind.LIMIT_ABOVE, SignalSynthesizer.orderKind(Direction.BEARISH, 100, 101));
		assertEquals(OrderKind.STOP_BELOW, SignalSynthesizer.orderKind(Direction.BEARISH, 102, 101));
	}

	private static EntryCandidate candidate() {
		return new EntryCandidate(SetupType.CONFLUENCE, Direction.BULLISH, 102, 100,
				Set.of(new ConfluenceSource(Horizon.H4, SourceKind.GAP), new ConfluenceSource(Horizon.H1, SourceKind.ZONE)),
				0.7);
	}

	private static CoordinatorResult bullishResult(double liquidityTarget, List<Sweep> sweeps) {
		return bullishResult(liquidityTarget, sweeps, List.of());
	}

	private static CoordinatorResult bullishResult(double liquidityTarget, List<Sweep> sweeps,
			List<ZoneFindings.Retest> retests) {
		TimeframeFindings h4 = findings(Horizon.H4, Trend.UPTREND, List.of(), List.of(),
				List.of(level(liquidityTarget, LiquidityLevel.Side.UPPER), level(95.0, LiquidityLevel.Side.LOWER)));
		TimeframeFindings h1 = findings(Horizon.H1, Trend.UPTREND, List.of(), List.of(), List.of());
		return new CoordinatorResult("EURUSD", BiasResolver.resolve(Trend.UPTREND, Trend.UPTREND),
				Map.of(Horizon.H4, Trend.UPTREND, Horizon.H1, Trend.UPTREND), List.of(), candidate(),
				PriceLocation.UNKNOWN, Map.of(Horizon.H4, h4, Horizon.H1, h1), sweeps, retests);
	}
}
