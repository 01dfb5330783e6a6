package com.smc.strategy;

import com.smc.market.Horizon;

public final class SmcLogV1 {

	private SmcLogV1() {
	}

	public interface DiagnosticRecord {
		String symbol();
	}

	public record TimeframeFindingsLogDto(
			String symbol,
			Horizon horizon,
			int candles,
			Long lastCloseTime,
			Double lastClose,
			int gaps,
			int openGaps,
			int zones,
			int flippedZones,
			int retests,
			Trend trend,
			int structureEvents,
			int liquidityLevels,
			int sweeps) implements DiagnosticRecord {
	}

	public record TimeframeUnavailableLogDto(
			String symbol,
			Horizon horizon,
			String reason,
			Integer received,
			Integer requested) implements DiagnosticRecord {
	}

	public record InvalidBoundsLogDto(
			String symbol,
			Horizon horizon,
			Integer sourceIndex,
			Double high,
			Double low) implements DiagnosticRecord {
	}

	public record BiasDecisionLogDto(
			String symbol,
			Bias bias,
			BiasTier tier,
			Trend widest,
			Trend second,
			Double price,
			PriceLocation location,
			int confluenceZones,
			SetupType setup,
			Double candidateUpper,
			Double candidateLower,
			int recentSweeps) implements DiagnosticRecord {
	}

	public record BiasChangedLogDto(
			String symbol,
			Bias previous,
			Bias current,
			BiasTier tier) implements DiagnosticRecord {
	}

	public record SignalRejectedLogDto(
			String symbol,
			Bias bias,
			String reason,
			Double price,
			Double rewardRisk,
			Double confidence) implements DiagnosticRecord {
	}

	public record SignalEmittedLogDto(
			String symbol,
			Direction direction,
			OrderKind orderKind,
			Double price,
			Double entry,
			Double stop,
			Double target,
			Double rewardRisk,
			Double confidence,
			SetupType setup,
			String rationale) implements DiagnosticRecord {
	}
}
