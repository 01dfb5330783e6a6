package com.smc.strategy;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.smc.market.Horizon;

import jakarta.validation.constraints.NotEmpty;

@Validated
@ConfigurationProperties(prefix = "smc")
public record SmcProperties(
		@NotEmpty List<String> symbols,
		double pointSize,
		Map<String, Double> pointSizes,
		Map<Horizon, HorizonSettings> horizons,
		GapSettings gap,
		ZoneSettings zone,
		StructureSettings structure,
		LiquiditySettings liquidity,
		ConfluenceSettings confluence,
		SignalSettings signal,
		EngineSettings engine) {

	public SmcProperties {
		if (symbols == null) {
			symbols = List.of();
		}
		if (pointSize <= 0) {
			pointSize = 0.0001;
		}
		if (pointSizes == null) {
			pointSizes = Map.of();
		}
		Map<Horizon, HorizonSettings> resolved = new EnumMap<>(Horizon.class);
		for (Horizon horizon : Horizon.values()) {
			HorizonSettings configured = horizons == null ? null : horizons.get(horizon);
			resolved.put(horizon, HorizonSettings.resolve(horizon, configured));
		}
		horizons = Map.copyOf(resolved);
		if (gap == null) {
			gap = new GapSettings(0.0, null, 0);
		}
		if (zone == null) {
			zone = new ZoneSettings(0, 0.0, 0);
		}
		if (structure == null) {
			structure = new StructureSettings(0);
		}
		if (liquidity == null) {
			liquidity = new LiquiditySettings(0, 0, 0.0, 0.0, 0, 0, null);
		}
		if (confluence == null) {
			confluence = new ConfluenceSettings(null, null, null, null, 0);
		}
		if (signal == null) {
			signal = new SignalSettings(null, null, null, null, null, null, null, null, null, null, null, null);
		}
		if (engine == null) {
			engine = new EngineSettings(false, null, 0);
		}
	}

	public double pointSize(String symbol) {
		Double override = pointSizes.get(symbol);
		return override != null && override > 0 ? override : pointSize;
	}

	public HorizonSettings horizon(Horizon horizon) {
		return horizons.get(horizon);
	}

	public record HorizonSettings(int candleCount, Duration refreshCadence, Duration maxStaleness) {

		static HorizonSettings resolve(Horizon horizon, HorizonSettings configured) {
			int candleCount = configured != null && configured.candleCount() > 0 ? configured.candleCount() : 100;
			Duration cadence = configured != null && configured.refreshCadence() != null
					? configured.refreshCadence()
					: defaultCadence(horizon);
			Duration staleness = configured != null && configured.maxStaleness() != null
					? configured.maxStaleness()
					: horizon.duration().multipliedBy(2);
			return new HorizonSettings(candleCount, cadence, staleness);
		}

		private static Duration defaultCadence(Horizon horizon) {
			return switch (horizon) {
				case H4 -> Duration.ofMinutes(15);
				case H1 -> Duration.ofMinutes(5);
				case M15 -> Duration.ofMinutes(1);
				case M5 -> Duration.ofSeconds(10);
			};
		}
	}

	public record GapSettings(double minSizePoints, Duration fillRetention, int maxTracked) {

		public GapSettings {
			if (minSizePoints < 0) {
				minSizePoints = 0.0;
			}
			if (fillRetention == null) {
				fillRetention = Duration.ofHours(24);
			}
			if (maxTracked <= 0) {
				maxTracked = 200;
			}
		}
	}

	public record ZoneSettings(int minRunLength, double minMovePoints, int originLookback) {

		public ZoneSettings {
			if (minRunLength <= 0) {
				minRunLength = 3;
			}
			if (minMovePoints <= 0) {
				minMovePoints = 20.0;
			}
			if (originLookback <= 0) {
				originLookback = 5;
			}
		}
	}

	public record StructureSettings(int swingWindow) {

		public StructureSettings {
			if (swingWindow <= 0) {
				swingWindow = 2;
			}
		}
	}

	public record LiquiditySettings(
			int lookback,
			int swingWindow,
			double touchTolerancePoints,
			double sweepTolerancePoints,
			int maxLevelsPerSide,
			int sweepLogCapacity,
			Duration sweepRecency) {

		public LiquiditySettings {
			if (lookback <= 0) {
				lookback = 50;
			}
			if (swingWindow <= 0) {
				swingWindow = 2;
			}
			if (touchTolerancePoints <= 0) {
				touchTolerancePoints = 3.0;
			}
			if (sweepTolerancePoints <= 0) {
				sweepTolerancePoints = 10.0;
			}
			if (maxLevelsPerSide <= 0) {
				maxLevelsPerSide = 5;
			}
			if (sweepLogCapacity <= 0) {
				sweepLogCapacity = 50;
			}
			if (sweepRecency == null) {
				sweepRecency = Duration.ofHours(4);
			}
		}
	}

	public record ConfluenceSettings(
			Double baseConfidence,
			Double stepPerSource,
			Double maxConfidence,
			Double fallbackConfidence,
			int maxCandidatesPerHorizon) {

		public ConfluenceSettings {
			if (baseConfidence == null) {
				baseConfidence = 0.7;
			}
			if (stepPerSource == null) {
				stepPerSource = 0.1;
			}
			if (maxConfidence == null) {
				maxConfidence = 0.95;
			}
			if (fallbackConfidence == null) {
				fallbackConfidence = 0.6;
			}
			if (maxCandidatesPerHorizon <= 0) {
				maxCandidatesPerHorizon = 20;
			}
		}
	}

	public record SignalSettings(
			Double minRewardRisk,
			Double stopBufferRangeFraction,
			Double minStopBufferPoints,
			Double agreementConfidence,
			Double widestPriorityConfidence,
			Double secondFallbackConfidence,
			Double neutralConfidence,
			Double biasWeight,
			Double confluenceWeight,
			Double sweepWeight,
			Double retestWeight,
			Double minConfidence) {

		public SignalSettings {
			if (minRewardRisk == null) {
				minRewardRisk = 2.0;
			}
			if (stopBufferRangeFraction == null) {
				stopBufferRangeFraction = 0.1;
			}
			if (minStopBufferPoints == null) {
				minStopBufferPoints = 1.0;
			}
			if (agreementConfidence == null) {
				agreementConfidence = 0.9;
			}
			if (widestPriorityConfidence == null) {
				widestPriorityConfidence = 0.75;
			}
			if (secondFallbackConfidence == null) {
				secondFallbackConfidence = 0.55;
			}
			if (neutralConfidence == null) {
				neutralConfidence = 0.0;
			}
			if (biasWeight == null) {
				biasWeight = 0.5;
			}
			if (confluenceWeight == null) {
				confluenceWeight = 0.3;
			}
			if (sweepWeight == null) {
				sweepWeight = 0.2;
			}
			if (retestWeight == null) {
				retestWeight = 0.1;
			}
			if (minConfidence == null) {
				minConfidence = 0.0;
			}
		}

		public double tierConfidence(BiasTier tier) {
			return switch (tier) {
				case AGREEMENT -> agreementConfidence;
				case WIDEST_PRIORITY -> widestPriorityConfidence;
				case SECOND_FALLBACK -> secondFallbackConfidence;
				case NONE -> neutralConfidence;
			};
		}
	}

	public record EngineSettings(boolean enabled, Duration evaluationInterval, int concurrency) {

		public EngineSettings {
			if (evaluationInterval == null) {
				evaluationInterval = Duration.ofSeconds(10);
			}
			if (concurrency <= 0) {
				concurrency = 4;
			}
		}
	}
}
