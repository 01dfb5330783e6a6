package com.smc.market;

import java.time.Instant;

public interface MarketHoursGate {

	boolean isOpen(String symbol, Instant now);
}
