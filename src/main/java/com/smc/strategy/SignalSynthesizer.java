package com.smc.strategy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.smc.market.Horizon;
import com.smc.strategy.detectors.Gap;
import com.smc.strategy.detectors.LiquidityLevel;
import com.smc.strategy.detectors.ReversalZone;
import com.smc.strategy.detectors.Sweep;

@Component
public class SignalSynthesizer {

	private final SmcProperties properties;

	public SignalSynthesizer(SmcProperties properties) {
		this.properties = properties;
	}

	public SignalDecision synthesize(CoordinatorResult result, double currentPrice, Instant now) {
		SmcProperties.SignalSettings settings = properties.signal();
		Direction direction = result.bias().bias().direction();
		if (direction == null) {
			return SignalDecision.rejected(SignalDecision.REASON_NEUTRAL_BIAS);
		}
		Optional<EntryCandidate> maybeCandidate = result.entryCandidate();
		if (maybeCandidate.isEmpty()) {
			return SignalDecision.rejected(SignalDecision.REASON_NO_CANDIDATE);
		}
		EntryCandidate candidate = maybeCandidate.get();
		boolean bullish = direction == Direction.BULLISH;
		double entry = candidate.entryLevel();
		double buffer = stopBuffer(candidate.range(), properties.pointSize(result.symbol()), settings);
		double stop = bullish ? candidate.lower() - buffer : candidate.upper() + buffer;
		double risk = Math.abs(entry - stop);
		if (!Double.isFinite(risk) || risk <= 0) {
			return SignalDecision.rejected(SignalDecision.REASON_INVALID_RISK);
		}

		Optional<Target> target = findTarget(result, direction, entry);
		if (target.isEmpty()) {
			return SignalDecision.rejected(SignalDecision.REASON_NO_TARGET);
		}
		double rewardRisk = Math.abs(target.get().price() - entry) / risk;
		boolean sweepConfirmed = hasFavourableSweep(result.recentSweeps(), direction);
		boolean retested = !result.candidateRetests().isEmpty();
		double confidence = confidence(result.bias().tier(), candidate.sourceCount(), sweepConfirmed, retested,
				settings);
		if (!ScoreMath.atLeast(rewardRisk, settings.minRewardRisk())) {
			return SignalDecision.rejected(SignalDecision.REASON_RR_BELOW_MIN, rewardRisk, confidence);
		}
		if (!ScoreMath.atLeast(confidence, settings.minConfidence())) {
			return SignalDecision.rejected(SignalDecision.REASON_LOW_CONFIDENCE, rewardRisk, confidence);
		}

		List<String> rationale = new ArrayList<>();
		rationale.add("BIAS_" + result.bias().tier().name());
		rationale.add("SETUP_" + candidate.setup().name());
		candidate.sources().stream()
				.map(ConfluenceSource::tag)
				.sorted()
				.forEach(rationale::add);
		rationale.add("TARGET_" + target.get().kind());
		if (sweepConfirmed) {
			rationale.add("SWEEP_CONFIRMED");
		}
		result.candidateRetests().stream()
				.map(retest -> retest.zone().horizon().name() + "_" + retest.zone().kind().name() + "_RETEST")
				.distinct()
				.sorted()
				.forEach(rationale::add);
		if (result.location() != PriceLocation.UNKNOWN) {
			rationale.add("LOCATION_" + result.location().name());
		}

		SignalProposal proposal = new SignalProposal(
				result.symbol(),
				direction,
				orderKind(direction, currentPrice, entry),
				entry,
				stop,
				target.get().price(),
				rewardRisk,
				confidence,
				candidate.setup(),
				rationale,
				result.trends(),
				now.toEpochMilli());
		return SignalDecision.emitted(proposal);
	}

	public static OrderKind orderKind(Direction direction, double currentPrice, double entry) {
		if (direction == Direction.BULLISH) {
			return currentPrice > entry ? OrderKind.LIMIT_BELOW : OrderKind.STOP_ABOVE;
		}
		return currentPrice < entry ? OrderKind.LIMIT_ABOVE : OrderKind.STOP_BELOW;
	}

	static double stopBuffer(double range, double pointSize, SmcProperties.SignalSettings settings) {
		return Math.max(range * settings.stopBufferRangeFraction(), settings.minStopBufferPoints() * pointSize);
	}

	static double confidence(BiasTier tier, int sourceCount, boolean sweepConfirmed, boolean retested,
			SmcProperties.SignalSettings settings) {
		double confluence = Math.min(1.0, Math.max(0, sourceCount - 1) / 2.0);
		double raw = settings.biasWeight() * settings.tierConfidence(tier)
				+ settings.confluenceWeight() * confluence
				+ settings.sweepWeight() * (sweepConfirmed ? 1.0 : 0.0)
				+ settings.retestWeight() * (retested ? 1.0 : 0.0);
		return ScoreMath.clamp(raw, 0.0, 1.0);
	}

	/**
	 * Nearest opposing unfilled gap edge, active opposing zone edge or unswept
	 * liquidity level strictly beyond the entry in the trade direction.
	 */
	static Optional<Target> findTarget(CoordinatorResult result, Direction direction, double entry) {
		boolean bullish = direction == Direction.BULLISH;
		Direction opposing = direction.opposite();
		LiquidityLevel.Side side = bullish ? LiquidityLevel.Side.UPPER : LiquidityLevel.Side.LOWER;
		Target best = null;
		for (Horizon horizon : Horizon.values()) {
			TimeframeFindings findings = result.snapshot().get(horizon);
			if (findings == null) {
				continue;
			}
			for (Gap gap : findings.unfilledGaps(opposing)) {
				best = closer(best, new Target(bullish ? gap.lower() : gap.upper(), "GAP"), entry, bullish);
			}
			for (ReversalZone zone : findings.zones().active(opposing)) {
				best = closer(best, new Target(bullish ? zone.lower() : zone.upper(), "ZONE"), entry, bullish);
			}
			for (LiquidityLevel level : findings.liquidity().unswept(side)) {
				best = closer(best, new Target(level.price(), "LIQUIDITY"), entry, bullish);
			}
		}
		return Optional.ofNullable(best);
	}

	private static Target closer(Target current, Target candidate, double entry, boolean bullish) {
		boolean beyond = bullish ? candidate.price() > entry : candidate.price() < entry;
		if (!beyond) {
			return current;
		}
		if (current == null) {
			return candidate;
		}
		double currentDistance = Math.abs(current.price() - entry);
		double candidateDistance = Math.abs(candidate.price() - entry);
		return candidateDistance < currentDistance ? candidate : current;
	}

	private static boolean hasFavourableSweep(List<Sweep> sweeps, Direction direction) {
		return sweeps.stream().anyMatch(sweep -> sweep.direction() == direction);
	}

	record Target(double price, String kind) {
	}
}
