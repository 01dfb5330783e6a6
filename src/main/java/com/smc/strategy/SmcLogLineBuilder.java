package com.smc.strategy;

import java.math.BigDecimal;

public final class SmcLogLineBuilder {

	private SmcLogLineBuilder() {
	}

	public static String build(SmcLogV1.DiagnosticRecord record) {
		if (record instanceof SmcLogV1.TimeframeFindingsLogDto dto) {
			return buildTimeframeFindingsLine(dto);
		}
		if (record instanceof SmcLogV1.TimeframeUnavailableLogDto dto) {
			return buildTimeframeUnavailableLine(dto);
		}
		if (record instanceof SmcLogV1.InvalidBoundsLogDto dto) {
			return buildInvalidBoundsLine(dto);
		}
		if (record instanceof SmcLogV1.BiasDecisionLogDto dto) {
			return buildBiasDecisionLine(dto);
		}
		if (record instanceof SmcLogV1.BiasChangedLogDto dto) {
			return buildBiasChangedLine(dto);
		}
		if (record instanceof SmcLogV1.SignalRejectedLogDto dto) {
			return buildSignalRejectedLine(dto);
		}
		if (record instanceof SmcLogV1.SignalEmittedLogDto dto) {
			return buildSignalEmittedLine(dto);
		}
		return "EVENT=UNKNOWN symbol=" + na(record == null ? null : record.symbol());
	}

	public static String buildTimeframeFindingsLine(SmcLogV1.TimeframeFindingsLogDto dto) {
		StringBuilder builder = new StringBuilder(256);
		builder.append("EVENT=TIMEFRAME_FINDINGS")
				.append(" symbol=").append(na(dto.symbol()))
				.append(" tf=").append(name(dto.horizon()))
				.append(" candles=").append(dto.candles())
				.append(" lastCloseTime=").append(nl(dto.lastCloseTime()))
				.append(" lastClose=").append(num(dto.lastClose()))
				.append(" gaps=").append(dto.gaps())
				.append(" openGaps=").append(dto.openGaps())
				.append(" zones=").append(dto.zones())
				.append(" flippedZones=").append(dto.flippedZones())
				.append(" retests=").append(dto.retests())
				.append(" trend=").append(name(dto.trend()))
				.append(" structureEvents=").append(dto.structureEvents())
				.append(" liquidityLevels=").append(dto.liquidityLevels())
				.append(" sweeps=").append(dto.sweeps());
		return builder.toString();
	}

	public static String buildTimeframeUnavailableLine(SmcLogV1.TimeframeUnavailableLogDto dto) {
		StringBuilder builder = new StringBuilder(128);
		builder.append("EVENT=TIMEFRAME_UNAVAILABLE")
				.append(" symbol=").append(na(dto.symbol()))
				.append(" tf=").append(name(dto.horizon()))
				.append(" reason=").append(na(dto.reason()))
				.append(" received=").append(na(dto.received()))
				.append(" requested=").append(na(dto.requested()));
		return builder.toString();
	}

	public static String buildInvalidBoundsLine(SmcLogV1.InvalidBoundsLogDto dto) {
		StringBuilder builder = new StringBuilder(128);
		builder.append("EVENT=INVALID_BOUNDS")
				.append(" symbol=").append(na(dto.symbol()))
				.append(" tf=").append(name(dto.horizon()))
				.append(" sourceIndex=").append(na(dto.sourceIndex()))
				.append(" high=").append(num(dto.high()))
				.append(" low=").append(num(dto.low()));
		return builder.toString();
	}

	public static String buildBiasDecisionLine(SmcLogV1.BiasDecisionLogDto dto) {
		StringBuilder builder = new StringBuilder(256);
		builder.append("EVENT=BIAS_DECISION")
				.append(" symbol=").append(na(dto.symbol()))
				.append(" bias=").append(name(dto.bias()))
				.append(" tier=").append(name(dto.tier()))
				.append(" trendH4=").append(name(dto.widest()))
				.append(" trendH1=").append(name(dto.second()))
				.append(" price=").append(num(dto.price()))
				.append(" location=").append(name(dto.location()))
				.append(" confluenceZones=").append(dto.confluenceZones())
				.append(" setup=").append(name(dto.setup()))
				.append(" candidateUpper=").append(num(dto.candidateUpper()))
				.append(" candidateLower=").append(num(dto.candidateLower()))
				.append(" recentSweeps=").append(dto.recentSweeps());
		return builder.toString();
	}

	public static String buildBiasChangedLine(SmcLogV1.BiasChangedLogDto dto) {
		StringBuilder builder = new StringBuilder(128);
		builder.append("EVENT=BIAS_CHANGED")
				.append(" symbol=").append(na(dto.symbol()))
				.append(" previous=").append(name(dto.previous()))
				.append(" current=").append(name(dto.current()))
				.append(" tier=").append(name(dto.tier()));
		return builder.toString();
	}

	public static String buildSignalRejectedLine(SmcLogV1.SignalRejectedLogDto dto) {
		StringBuilder builder = new StringBuilder(160);
		builder.append("EVENT=SIGNAL_REJECTED")
				.append(" symbol=").append(na(dto.symbol()))
				.append(" bias=").append(name(dto.bias()))
				.append(" reason=").append(na(dto.reason()))
				.append(" price=").append(num(dto.price()))
				.append(" rr=").append(num(dto.rewardRisk()))
				.append(" confidence=").append(num(dto.confidence()));
		return builder.toString();
	}

	public static String buildSignalEmittedLine(SmcLogV1.SignalEmittedLogDto dto) {
		StringBuilder builder = new StringBuilder(256);
		builder.append("EVENT=SIGNAL_EMITTED")
				.append(" symbol=").append(na(dto.symbol()))
				.append(" direction=").append(name(dto.direction()))
				.append(" orderKind=").append(name(dto.orderKind()))
				.append(" price=").append(num(dto.price()))
				.append(" entry=").append(num(dto.entry()))
				.append(" stop=").append(num(dto.stop()))
				.append(" target=").append(num(dto.target()))
				.append(" rr=").append(num(dto.rewardRisk()))
				.append(" confidence=").append(num(dto.confidence()))
				.append(" setup=").append(name(dto.setup()))
				.append(" rationale=").append(na(dto.rationale()));
		return builder.toString();
	}

	private static String na(Object value) {
		if (value == null) {
			return "NA";
		}
		String text = value.toString();
		return text.isBlank() ? "NA" : text;
	}

	private static String nl(Long value) {
		return value == null ? "NA" : value.toString();
	}

	private static String num(Double value) {
		if (value == null || value.isNaN() || value.isInfinite()) {
			return "NA";
		}
		return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
	}

	private static String name(Enum<?> value) {
		return value == null ? "NA" : value.name();
	}
}
