package com.smc.config;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "market")
public record MarketProperties(
		String timeZone,
		Session defaultSession,
		Map<String, Session> sessions,
		Map<String, String> brokerSymbols,
		CsvSource csv) {

	public MarketProperties {
		if (timeZone == null || timeZone.isBlank()) {
			timeZone = "GMT";
		}
		if (sessions == null) {
			sessions = Map.of();
		}
		if (brokerSymbols == null) {
			brokerSymbols = Map.of();
		}
		if (csv == null) {
			csv = new CsvSource(null, null, null, true, null, null, null, null, null, null, null,
					0, 0, 0, 0, 0, 0);
		}
	}

	public ZoneId zoneId() {
		return ZoneId.of(timeZone);
	}

	public Session sessionFor(String symbol) {
		Session session = sessions.get(symbol);
		return session != null ? session : defaultSession;
	}

	public record Session(
			String open,
			String close,
			String breakStart,
			String breakEnd,
			List<DayOfWeek> days) {

		public LocalTime openTime() {
			return parse(open);
		}

		public LocalTime closeTime() {
			return parse(close);
		}

		public LocalTime breakStartTime() {
			return parse(breakStart);
		}

		public LocalTime breakEndTime() {
			return parse(breakEnd);
		}

		public Set<DayOfWeek> tradingDays() {
			if (days == null || days.isEmpty()) {
				return EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);
			}
			return EnumSet.copyOf(days);
		}

		private static LocalTime parse(String value) {
			if (value == null || value.isBlank()) {
				return null;
			}
			return LocalTime.parse(value.trim());
		}
	}

	public record CsvSource(
			String dataDir,
			String filePattern,
			String delimiter,
			boolean hasHeader,
			String openColumn,
			String highColumn,
			String lowColumn,
			String closeColumn,
			String volumeColumn,
			String closeTimeColumn,
			String closeTimeUnit,
			int openIndex,
			int highIndex,
			int lowIndex,
			int closeIndex,
			int volumeIndex,
			int closeTimeIndex) {

		public CsvSource {
			if (dataDir == null || dataDir.isBlank()) {
				dataDir = "data";
			}
			if (filePattern == null || filePattern.isBlank()) {
				filePattern = "{symbol}.csv";
			}
			if (delimiter == null || delimiter.isEmpty()) {
				delimiter = ",";
			}
			if (openColumn == null) {
				openColumn = "open";
			}
			if (highColumn == null) {
				highColumn = "high";
			}
			if (lowColumn == null) {
				lowColumn = "low";
			}
			if (closeColumn == null) {
				closeColumn = "close";
			}
			if (volumeColumn == null) {
				volumeColumn = "volume";
			}
			if (closeTimeColumn == null) {
				closeTimeColumn = "close_time";
			}
			if (closeTimeUnit == null) {
				closeTimeUnit = "MILLIS";
			}
			if (openIndex <= 0 && highIndex <= 0 && lowIndex <= 0 && closeIndex <= 0 && volumeIndex <= 0
					&& closeTimeIndex <= 0) {
				openIndex = 1;
				highIndex = 2;
				lowIndex = 3;
				closeIndex = 4;
				volumeIndex = 5;
				closeTimeIndex = 6;
			}
		}
	}
}
