package com.smc.strategy.detectors;

import java.util.ArrayList;
import java.util.List;

import com.smc.market.Candle;
import com.smc.strategy.Direction;
import com.smc.strategy.Trend;

/**
 * Swing structure over a close-ordered series. A swing at index i is confirmed
 * once candle i + k has closed, so events only ever use confirmed swings. After
 * a trend shift only swings whose pivot lies after the shift candle take part
 * in classification and breaks.
 */
public final class StructureAnalyzer {

	private StructureAnalyzer() {
	}

	public static Structure analyze(List<Candle> candles, int swingWindow) {
		int k = Math.max(1, swingWindow);
		if (candles == null || candles.size() < 2 * k + 1) {
			return Structure.insufficient();
		}
		List<StructurePoint> points = new ArrayList<>();
		List<StructureEvent> events = new ArrayList<>();
		List<StructurePoint> highs = new ArrayList<>();
		List<StructurePoint> lows = new ArrayList<>();
		Trend trend = Trend.RANGING;
		StructurePoint brokenHigh = null;
		StructurePoint brokenLow = null;
		int shiftIndex = -1;

		for (int i = 0; i < candles.size(); i++) {
			int pivot = i - k;
			if (pivot >= k) {
				Candle candidate = candles.get(pivot);
				boolean current = pivot > shiftIndex;
				if (isSwingHigh(candles, pivot, k)) {
					StructurePoint point = new StructurePoint(candidate.high(), StructurePoint.Type.SWING_HIGH,
							candidate.closeTime());
					points.add(point);
					if (current) {
						highs.add(point);
					}
				}
				if (isSwingLow(candles, pivot, k)) {
					StructurePoint point = new StructurePoint(candidate.low(), StructurePoint.Type.SWING_LOW,
							candidate.closeTime());
					points.add(point);
					if (current) {
						lows.add(point);
					}
				}
				Trend classified = classify(highs, lows);
				if (classified != null) {
					trend = classified;
				}
			}

			Candle candle = candles.get(i);
			StructurePoint lastHigh = highs.isEmpty() ? null : highs.get(highs.size() - 1);
			StructurePoint lastLow = lows.isEmpty() ? null : lows.get(lows.size() - 1);
			if (trend == Trend.UPTREND) {
				if (lastLow != null && candle.close() < lastLow.price()) {
					events.add(new StructureEvent(StructureEvent.Type.TREND_SHIFT, Direction.BEARISH, lastLow.price(),
							candle.closeTime()));
					trend = Trend.DOWNTREND;
					highs.clear();
					lows.clear();
					brokenHigh = null;
					brokenLow = null;
					shiftIndex = i;
				} else if (lastHigh != null && candle.close() > lastHigh.price() && lastHigh != brokenHigh) {
					events.add(new StructureEvent(StructureEvent.Type.STRUCTURAL_BREAK, Direction.BULLISH,
							lastHigh.price(), candle.closeTime()));
					brokenHigh = lastHigh;
				}
			} else if (trend == Trend.DOWNTREND) {
				if (lastHigh != null && candle.close() > lastHigh.price()) {
					events.add(new StructureEvent(StructureEvent.Type.TREND_SHIFT, Direction.BULLISH, lastHigh.price(),
							candle.closeTime()));
					trend = Trend.UPTREND;
					highs.clear();
					lows.clear();
					brokenHigh = null;
					brokenLow = null;
					shiftIndex = i;
				} else if (lastLow != null && candle.close() < lastLow.price() && lastLow != brokenLow) {
					events.add(new StructureEvent(StructureEvent.Type.STRUCTURAL_BREAK, Direction.BEARISH,
							lastLow.price(), candle.closeTime()));
					brokenLow = lastLow;
				}
			}
		}
		return new Structure(points, trend, events, true);
	}

	/**
	 * Returns null while fewer than two swing highs and two swing lows are known.
	 */
	static Trend classify(List<StructurePoint> highs, List<StructurePoint> lows) {
		if (highs.size() < 2 || lows.size() < 2) {
			return null;
		}
		double lastHigh = highs.get(highs.size() - 1).price();
		double previousHigh = highs.get(highs.size() - 2).price();
		double lastLow = lows.get(lows.size() - 1).price();
		double previousLow = lows.get(lows.size() - 2).price();
		if (lastHigh > previousHigh && lastLow > previousLow) {
			return Trend.UPTREND;
		}
		if (lastHigh < previousHigh && lastLow < previousLow) {
			return Trend.DOWNTREND;
		}
		return Trend.RANGING;
	}

	static boolean isSwingHigh(List<Candle> candles, int index, int k) {
		double high = candles.get(index).high();
		for (int j = index - k; j <= index + k; j++) {
			if (j != index && candles.get(j).high() >= high) {
				return false;
			}
		}
		return true;
	}

	static boolean isSwingLow(List<Candle> candles, int index, int k) {
		double low = candles.get(index).low();
		for (int j = index - k; j <= index + k; j++) {
			if (j != index && candles.get(j).low() <= low) {
				return false;
			}
		}
		return true;
	}
}
