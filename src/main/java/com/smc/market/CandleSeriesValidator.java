package com.smc.market;

import java.util.List;

public final class CandleSeriesValidator {

	private CandleSeriesValidator() {
	}

	public static void validate(Horizon horizon, List<Candle> candles) {
		if (candles == null) {
			throw new InvalidCandleSeriesException(horizon, -1, "candle series is null");
		}
		long previousCloseTime = Long.MIN_VALUE;
		for (int i = 0; i < candles.size(); i++) {
			Candle candle = candles.get(i);
			if (candle == null) {
				throw new InvalidCandleSeriesException(horizon, i, "null candle at index " + i);
			}
			if (!validPrice(candle.open()) || !validPrice(candle.high()) || !validPrice(candle.low())
					|| !validPrice(candle.close())) {
				throw new InvalidCandleSeriesException(horizon, i,
						"invalid price at index " + i + " closeTime=" + candle.closeTime());
			}
			if (i > 0 && candle.closeTime() <= previousCloseTime) {
				throw new InvalidCandleSeriesException(horizon, i,
						"closeTime not strictly increasing at index " + i + " closeTime=" + candle.closeTime()
								+ " previous=" + previousCloseTime);
			}
			previousCloseTime = candle.closeTime();
		}
	}

	private static boolean validPrice(double value) {
		return Double.isFinite(value) && value >= 0.0;
	}
}
