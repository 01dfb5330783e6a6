package com.smc.strategy;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.smc.market.Candle;
import com.smc.market.CandleSource;
import com.smc.market.Horizon;
import com.smc.market.InvalidCandleSeriesException;
import com.smc.market.MarketHoursGate;
import com.smc.market.SymbolResolver;
import com.smc.strategy.cache.CacheKey;
import com.smc.strategy.cache.FindingsCache;
import com.smc.strategy.detectors.ZoneFindings;

import jakarta.annotation.PreDestroy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * One evaluation cycle per symbol: refresh the due horizons in parallel, then
 * coordinate and synthesize over the joined snapshot.
 */
@Service
public class SmcEngine {

	private static final Logger LOGGER = LoggerFactory.getLogger(SmcEngine.class);

	private final SmcProperties properties;
	private final CandleSource candleSource;
	private final MarketHoursGate marketHoursGate;
	private final SymbolResolver symbolResolver;
	private final TimeframeAnalyzer analyzer;
	private final FindingsCache findingsCache;
	private final MultiTimeframeCoordinator coordinator;
	private final SignalSynthesizer synthesizer;
	private final ProposalSink proposalSink;
	private final DiagnosticSink diagnosticSink;
	private final BiasChangeTracker biasChangeTracker;
	private final Clock clock;
	private final Scheduler fetchScheduler;

	public SmcEngine(SmcProperties properties,
			CandleSource candleSource,
			MarketHoursGate marketHoursGate,
			SymbolResolver symbolResolver,
			TimeframeAnalyzer analyzer,
			FindingsCache findingsCache,
			MultiTimeframeCoordinator coordinator,
			SignalSynthesizer synthesizer,
			ProposalSink proposalSink,
			DiagnosticSink diagnosticSink,
			BiasChangeTracker biasChangeTracker,
			Clock clock) {
		this.properties = properties;
		this.candleSource = candleSource;
		this.marketHoursGate = marketHoursGate;
		this.symbolResolver = symbolResolver;
		this.analyzer = analyzer;
		this.findingsCache = findingsCache;
		this.coordinator = coordinator;
		this.synthesizer = synthesizer;
		this.proposalSink = proposalSink;
		this.diagnosticSink = diagnosticSink;
		this.biasChangeTracker = biasChangeTracker;
		this.clock = clock;
		this.fetchScheduler = Schedulers.newBoundedElastic(
				Math.max(Horizon.values().length, properties.engine().concurrency() * Horizon.values().length),
				1000, "smc-candle-fetch");
	}

	@PreDestroy
	public void shutdown() {
		fetchScheduler.dispose();
	}

	public Mono<SignalDecision> evaluate(String symbol) {
		Instant now = clock.instant();
		if (!marketHoursGate.isOpen(symbol, now)) {
			LOGGER.debug("EVENT=EVALUATION_SKIPPED symbol={} reason={}", symbol, SignalDecision.REASON_MARKET_CLOSED);
			return Mono.just(SignalDecision.rejected(SignalDecision.REASON_MARKET_CLOSED));
		}
		Optional<String> brokerSymbol = symbolResolver.resolve(symbol);
		if (brokerSymbol.isEmpty()) {
			LOGGER.warn("EVENT=EVALUATION_SKIPPED symbol={} reason={}", symbol,
					SignalDecision.REASON_UNRESOLVED_SYMBOL);
			return Mono.just(SignalDecision.rejected(SignalDecision.REASON_UNRESOLVED_SYMBOL));
		}
		return snapshot(symbol, brokerSymbol.get(), now)
				.map(snapshot -> decide(symbol, snapshot, now));
	}

	/**
	 * Joins the per-horizon refreshes of one cycle. Gap fills seen on narrower
	 * horizons are applied to the wider horizons' cached findings.
	 */
	Mono<Map<Horizon, TimeframeFindings>> snapshot(String symbol, String brokerSymbol, Instant now) {
		return Flux.fromArray(Horizon.values())
				.flatMap(horizon -> refresh(symbol, brokerSymbol, horizon, now)
						.map(findings -> Map.entry(horizon, findings)), Horizon.values().length)
				.collectMap(Map.Entry::getKey, Map.Entry::getValue, () -> new EnumMap<>(Horizon.class))
				.map(snapshot -> analyzer.withTrackedGaps(symbol, snapshot));
	}

	Mono<TimeframeFindings> refresh(String symbol, String brokerSymbol, Horizon horizon, Instant now) {
		CacheKey key = new CacheKey(symbol, horizon);
		SmcProperties.HorizonSettings settings = properties.horizon(horizon);
		if (!findingsCache.refreshDue(key, now)) {
			return cached(key, now, settings, "STALE");
		}
		return Mono.fromCallable(() -> candleSource.getCandles(brokerSymbol, horizon, settings.candleCount()))
				.subscribeOn(fetchScheduler)
				.flatMap(candles -> analyze(symbol, horizon, candles, settings, key, now))
				.onErrorResume(error -> !(error instanceof InvalidCandleSeriesException), error -> {
					LOGGER.warn("EVENT=CANDLE_FETCH_FAILED symbol={} tf={} reason={}", symbol, horizon,
							error.getMessage());
					return cached(key, now, settings, "FETCH_FAILED");
				});
	}

	private Mono<TimeframeFindings> analyze(String symbol, Horizon horizon, List<Candle> candles,
			SmcProperties.HorizonSettings settings, CacheKey key, Instant now) {
		int received = candles == null ? 0 : candles.size();
		if (received < settings.candleCount()) {
			findingsCache.evict(key);
			publish(new SmcLogV1.TimeframeUnavailableLogDto(symbol, horizon, "INSUFFICIENT_DATA", received,
					settings.candleCount()));
			return Mono.empty();
		}
		TimeframeFindings findings = analyzer.analyze(symbol, horizon, candles, now);
		findingsCache.put(key, findings, now, settings.refreshCadence());
		for (ZoneFindings.Rejected rejected : findings.zones().rejected()) {
			publish(new SmcLogV1.InvalidBoundsLogDto(symbol, horizon, rejected.sourceIndex(), rejected.high(),
					rejected.low()));
		}
		publish(new SmcLogV1.TimeframeFindingsLogDto(
				symbol,
				horizon,
				findings.candleCount(),
				findings.lastCloseTime(),
				findings.lastClose(),
				findings.gaps().size(),
				findings.unfilledGaps().size(),
				findings.zones().zones().size(),
				findings.zones().flippedZones().size(),
				findings.zones().retests().size(),
				findings.trend(),
				findings.structure().events().size(),
				findings.liquidity().levels().size(),
				findings.liquidity().sweeps().size()));
		return Mono.just(findings);
	}

	private Mono<TimeframeFindings> cached(CacheKey key, Instant now, SmcProperties.HorizonSettings settings,
			String reason) {
		Optional<TimeframeFindings> findings = findingsCache.read(key, now, settings.maxStaleness());
		if (findings.isEmpty()) {
			publish(new SmcLogV1.TimeframeUnavailableLogDto(key.symbol(), key.horizon(), reason, null,
					settings.candleCount()));
		}
		return Mono.justOrEmpty(findings);
	}

	SignalDecision decide(String symbol, Map<Horizon, TimeframeFindings> snapshot, Instant now) {
		Optional<Double> price = currentPrice(snapshot);
		if (price.isEmpty()) {
			LOGGER.info("EVENT=EVALUATION_SKIPPED symbol={} reason={}", symbol, SignalDecision.REASON_NO_DATA);
			return SignalDecision.rejected(SignalDecision.REASON_NO_DATA);
		}
		double currentPrice = price.get();
		CoordinatorResult result = coordinator.coordinate(symbol, snapshot, currentPrice, now);
		BiasDecision bias = result.bias();
		EntryCandidate candidate = result.candidate();
		publish(new SmcLogV1.BiasDecisionLogDto(
				symbol,
				bias.bias(),
				bias.tier(),
				bias.widest(),
				bias.second(),
				currentPrice,
				result.location(),
				result.confluenceZones().size(),
				candidate == null ? null : candidate.setup(),
				candidate == null ? null : candidate.upper(),
				candidate == null ? null : candidate.lower(),
				result.recentSweeps().size()));
		biasChangeTracker.update(symbol, bias.bias())
				.ifPresent(previous -> publish(new SmcLogV1.BiasChangedLogDto(symbol, previous, bias.bias(),
						bias.tier())));

		SignalDecision decision = synthesizer.synthesize(result, currentPrice, now);
		if (decision.accepted()) {
			SignalProposal proposal = decision.proposal();
			publish(new SmcLogV1.SignalEmittedLogDto(
					symbol,
					proposal.direction(),
					proposal.orderKind(),
					currentPrice,
					proposal.entry(),
					proposal.stop(),
					proposal.target(),
					proposal.rewardRisk(),
					proposal.confidence(),
					proposal.setup(),
					String.join(",", proposal.rationale())));
			try {
				proposalSink.accept(proposal);
			} catch (RuntimeException ex) {
				LOGGER.warn("EVENT=PROPOSAL_SINK_FAIL symbol={} reason={}", symbol, ex.getMessage());
			}
		} else {
			publish(new SmcLogV1.SignalRejectedLogDto(symbol, bias.bias(), decision.reason(), currentPrice,
					decision.rewardRisk(), decision.confidence()));
		}
		return decision;
	}

	static Optional<Double> currentPrice(Map<Horizon, TimeframeFindings> snapshot) {
		Horizon[] horizons = Horizon.values();
		for (int i = horizons.length - 1; i >= 0; i--) {
			TimeframeFindings findings = snapshot.get(horizons[i]);
			if (findings != null) {
				return Optional.of(findings.lastClose());
			}
		}
		return Optional.empty();
	}

	private void publish(SmcLogV1.DiagnosticRecord record) {
		try {
			diagnosticSink.publish(record);
		} catch (RuntimeException ex) {
			LOGGER.warn("EVENT=DIAGNOSTIC_SINK_FAIL symbol={} reason={}", record.symbol(), ex.getMessage());
		}
	}
}
