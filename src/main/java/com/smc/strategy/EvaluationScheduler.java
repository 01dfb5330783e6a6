package com.smc.strategy;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PreDestroy;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

public class EvaluationScheduler {

	private static final Logger LOGGER = LoggerFactory.getLogger(EvaluationScheduler.class);

	private final SmcEngine engine;
	private final SmcProperties properties;
	private final Scheduler scheduler;
	private final AtomicLong cycles = new AtomicLong();
	private Disposable task;

	public EvaluationScheduler(SmcEngine engine, SmcProperties properties) {
		this.engine = engine;
		this.properties = properties;
		this.scheduler = Schedulers.newBoundedElastic(properties.engine().concurrency(), 1000, "smc-evaluation");
	}

	public synchronized void start() {
		if (task != null) {
			return;
		}
		Duration interval = properties.engine().evaluationInterval();
		LOGGER.info("EVENT=EVALUATION_SCHEDULER_START symbols={} intervalMs={} concurrency={}",
				properties.symbols(), interval.toMillis(), properties.engine().concurrency());
		task = Flux.interval(Duration.ZERO, interval, scheduler)
				.onBackpressureDrop(tick -> LOGGER.debug("EVENT=EVALUATION_TICK_DROPPED tick={}", tick))
				.flatMap(tick -> evaluateAll(properties.symbols()), 1)
				.subscribe(null, ex -> LOGGER.error("EVENT=EVALUATION_SCHEDULER_ERROR message={}", ex.getMessage(), ex));
	}

	public Mono<Void> evaluateAll(List<String> symbols) {
		long cycle = cycles.incrementAndGet();
		long start = System.currentTimeMillis();
		return Flux.fromIterable(symbols)
				.flatMap(symbol -> engine.evaluate(symbol)
						.onErrorResume(error -> {
							LOGGER.warn("EVENT=EVALUATION_FAILED symbol={} reason={}", symbol, error.getMessage());
							return Mono.empty();
						}), properties.engine().concurrency())
				.filter(SignalDecision::accepted)
				.count()
				.doOnNext(emitted -> LOGGER.debug("EVENT=EVALUATION_CYCLE_DONE cycle={} symbols={} emitted={} durationMs={}",
						cycle, symbols.size(), emitted, System.currentTimeMillis() - start))
				.then();
	}

	@PreDestroy
	public synchronized void shutdown() {
		if (task != null) {
			task.dispose();
			task = null;
		}
		scheduler.dispose();
	}
}
