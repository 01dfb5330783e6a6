package com.smc.market;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZonedDateTime;

import com.smc.config.MarketProperties;

/**
 * Daily trading session per symbol. A session whose close is before its open
 * runs across midnight and belongs to the day it closes on.
 */
public class SessionMarketHoursGate implements MarketHoursGate {

	private final MarketProperties properties;

	public SessionMarketHoursGate(MarketProperties properties) {
		this.properties = properties;
	}

	@Override
	public boolean isOpen(String symbol, Instant now) {
		MarketProperties.Session session = properties.sessionFor(symbol);
		if (session == null) {
			return false;
		}
		LocalTime open = session.openTime();
		LocalTime close = session.closeTime();
		if (open == null || close == null) {
			return false;
		}
		ZonedDateTime local = now.atZone(properties.zoneId());
		LocalTime time = local.toLocalTime();
		DayOfWeek tradingDay = local.getDayOfWeek();
		boolean inSession;
		if (open.equals(close)) {
			inSession = true;
		} else if (open.isBefore(close)) {
			inSession = !time.isBefore(open) && time.isBefore(close);
		} else {
			boolean evening = !time.isBefore(open);
			inSession = evening || time.isBefore(close);
			if (evening) {
				tradingDay = tradingDay.plus(1);
			}
		}
		if (!inSession || !session.tradingDays().contains(tradingDay)) {
			return false;
		}
		return !inBreak(session, time);
	}

	private boolean inBreak(MarketProperties.Session session, LocalTime time) {
		LocalTime start = session.breakStartTime();
		LocalTime end = session.breakEndTime();
		if (start == null || end == null || start.equals(end)) {
			return false;
		}
		if (start.isBefore(end)) {
			return !time.isBefore(start) && time.isBefore(end);
		}
		return !time.isBefore(start) || time.isBefore(end);
	}
}
