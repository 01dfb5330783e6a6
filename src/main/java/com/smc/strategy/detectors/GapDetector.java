package com.smc.strategy.detectors;

import java.util.ArrayList;
import java.util.List;

import com.smc.market.Candle;
import com.smc.market.Horizon;
import com.smc.strategy.Direction;

/**
 * Three-candle imbalance detection. The first and third candle of a triple must
 * not overlap; equality is not a gap.
 */
public final class GapDetector {

	private GapDetector() {
	}

	public static List<Gap> detect(Horizon horizon, List<Candle> candles, double minSize) {
		if (candles == null || candles.size() < 3) {
			return List.of();
		}
		List<Gap> gaps = new ArrayList<>();
		for (int i = 0; i + 2 < candles.size(); i++) {
			Candle first = candles.get(i);
			Candle third = candles.get(i + 2);
			Gap gap = null;
			if (first.low() > third.high()) {
				gap = Gap.open(horizon, Direction.BULLISH, first.low(), third.high(), third.closeTime(), i);
			} else if (first.high() < third.low()) {
				gap = Gap.open(horizon, Direction.BEARISH, third.low(), first.high(), third.closeTime(), i);
			}
			if (gap != null && gap.size() >= minSize) {
				gaps.add(gap);
			}
		}
		return scanFills(gaps, candles);
	}

	/**
	 * A gap is filled once the candles after its creation have traded through its
	 * whole range. Filled gaps are returned unchanged.
	 */
	public static List<Gap> scanFills(List<Gap> gaps, List<Candle> candles) {
		List<Gap> result = new ArrayList<>(gaps.size());
		for (Gap gap : gaps) {
			result.add(gap.filled() ? gap : scanFill(gap, candles));
		}
		return result;
	}

	private static Gap scanFill(Gap gap, List<Candle> candles) {
		double minLow = Double.POSITIVE_INFINITY;
		double maxHigh = Double.NEGATIVE_INFINITY;
		for (Candle candle : candles) {
			if (candle.closeTime() <= gap.createdAt()) {
				continue;
			}
			minLow = Math.min(minLow, candle.low());
			maxHigh = Math.max(maxHigh, candle.high());
			if (minLow <= gap.lower() && maxHigh >= gap.upper()) {
				return gap.markFilled(candle.closeTime());
			}
		}
		return gap;
	}
}
