package com.smc.config;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smc.market.CandleSource;
import com.smc.market.ConfiguredSymbolResolver;
import com.smc.market.CsvCandleSource;
import com.smc.market.MarketHoursGate;
import com.smc.market.SessionMarketHoursGate;
import com.smc.market.SymbolResolver;
import com.smc.strategy.BiasChangeTracker;
import com.smc.strategy.DiagnosticSink;
import com.smc.strategy.EvaluationScheduler;
import com.smc.strategy.LoggingDiagnosticSink;
import com.smc.strategy.LoggingProposalSink;
import com.smc.strategy.ProposalSink;
import com.smc.strategy.SmcEngine;
import com.smc.strategy.SmcProperties;
import com.smc.strategy.cache.FindingsCache;
import com.smc.strategy.cache.GapLedger;
import com.smc.strategy.cache.SweepLog;

@Configuration
@EnableConfigurationProperties({SmcProperties.class, MarketProperties.class})
public class SmcConfiguration {

	@Bean
	@ConditionalOnMissingBean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public GapLedger gapLedger(SmcProperties properties) {
		return new GapLedger(properties.gap().fillRetention(), properties.gap().maxTracked());
	}

	@Bean
	public SweepLog sweepLog(SmcProperties properties) {
		return new SweepLog(properties.liquidity().sweepLogCapacity());
	}

	@Bean
	public FindingsCache findingsCache() {
		return new FindingsCache();
	}

	@Bean
	public BiasChangeTracker biasChangeTracker() {
		return new BiasChangeTracker();
	}

	@Bean
	@ConditionalOnMissingBean
	public MarketHoursGate marketHoursGate(MarketProperties properties) {
		return new SessionMarketHoursGate(properties);
	}

	@Bean
	@ConditionalOnMissingBean
	public SymbolResolver symbolResolver(MarketProperties properties) {
		return new ConfiguredSymbolResolver(properties);
	}

	@Bean
	@ConditionalOnMissingBean
	public CandleSource candleSource(MarketProperties properties) {
		return new CsvCandleSource(properties);
	}

	@Bean
	@ConditionalOnMissingBean
	public ProposalSink proposalSink(ObjectMapper objectMapper) {
		return new LoggingProposalSink(objectMapper);
	}

	@Bean
	@ConditionalOnMissingBean
	public DiagnosticSink diagnosticSink() {
		return new LoggingDiagnosticSink();
	}

	@Bean(initMethod = "start")
	@ConditionalOnProperty(prefix = "smc.engine", name = "enabled", havingValue = "true")
	public EvaluationScheduler evaluationScheduler(SmcEngine engine, SmcProperties properties) {
		return new EvaluationScheduler(engine, properties);
	}
}
