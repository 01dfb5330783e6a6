package com.smc.market;

import java.util.List;

public interface CandleSource {

	/**
	 * Returns up to {@code count} closed candles for the broker symbol, oldest first.
	 */
	List<Candle> getCandles(String brokerSymbol, Horizon horizon, int count);
}
