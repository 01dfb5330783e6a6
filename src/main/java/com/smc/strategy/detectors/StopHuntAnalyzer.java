package com.smc.strategy.detectors;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.smc.market.Candle;
import com.smc.market.Horizon;

/**
 * Tracks resting liquidity above swing highs and below swing lows and reports
 * the spikes through it that are rejected back to the originating side.
 */
public final class StopHuntAnalyzer {

	private StopHuntAnalyzer() {
	}

	public static LiquidityFindings analyze(Horizon horizon, List<Candle> candles, Params params) {
		if (candles == null) {
			return LiquidityFindings.empty();
		}
		int k = Math.max(1, params.swingWindow());
		int from = Math.max(0, candles.size() - Math.max(params.lookback(), 2 * k + 1));
		List<Candle> window = candles.subList(from, candles.size());
		if (window.size() < 2 * k + 1) {
			return LiquidityFindings.empty();
		}

		List<LiquidityLevel> levels = new ArrayList<>();
		List<Sweep> sweeps = new ArrayList<>();
		for (int pivot = k; pivot + k < window.size(); pivot++) {
			if (StructureAnalyzer.isSwingHigh(window, pivot, k)) {
				track(horizon, window, pivot, LiquidityLevel.Side.UPPER, params, levels, sweeps);
			}
			if (StructureAnalyzer.isSwingLow(window, pivot, k)) {
				track(horizon, window, pivot, LiquidityLevel.Side.LOWER, params, levels, sweeps);
			}
		}
		sweeps.sort(Comparator.comparingLong(Sweep::confirmTime));
		return new LiquidityFindings(cap(levels, params.maxLevelsPerSide()), sweeps);
	}

	private static void track(Horizon horizon, List<Candle> window, int pivot, LiquidityLevel.Side side,
			Params params, List<LiquidityLevel> levels, List<Sweep> sweeps) {
		Candle origin = window.get(pivot);
		boolean upper = side == LiquidityLevel.Side.UPPER;
		double price = upper ? origin.high() : origin.low();
		for (LiquidityLevel existing : levels) {
			if (existing.side() == side && Math.abs(existing.price() - price) <= params.touchTolerance()) {
				return;
			}
		}

		int touches = 0;
		for (int m = pivot + 1; m < window.size(); m++) {
			Candle candle = window.get(m);
			double extreme = upper ? candle.high() : candle.low();
			double breach = upper ? extreme - price : price - extreme;
			boolean closedThrough = upper ? candle.close() > price : candle.close() < price;
			Candle next = m + 1 < window.size() ? window.get(m + 1) : null;
			boolean nextReclaims = next != null && (upper ? next.close() <= price : next.close() >= price);

			if (breach > params.sweepTolerance()) {
				if (!closedThrough || nextReclaims) {
					long confirmTime = closedThrough ? next.closeTime() : candle.closeTime();
					levels.add(new LiquidityLevel(price, side, touches, true, candle.closeTime(), origin.closeTime()));
					sweeps.add(new Sweep(horizon, side, price, extreme, candle.closeTime(), confirmTime));
				}
				return;
			}
			if (closedThrough) {
				if (!nextReclaims) {
					return;
				}
				continue;
			}
			if (breach >= -params.touchTolerance()) {
				touches++;
			}
		}
		levels.add(new LiquidityLevel(price, side, touches, false, null, origin.closeTime()));
	}

	private static List<LiquidityLevel> cap(List<LiquidityLevel> levels, int maxPerSide) {
		if (maxPerSide <= 0) {
			return levels;
		}
		List<LiquidityLevel> capped = new ArrayList<>();
		for (LiquidityLevel.Side side : LiquidityLevel.Side.values()) {
			levels.stream()
					.filter(level -> level.side() == side)
					.sorted(Comparator.comparingInt(LiquidityLevel::touchCount).reversed()
							.thenComparing(Comparator.comparingLong(LiquidityLevel::formedAt).reversed()))
					.limit(maxPerSide)
					.forEach(capped::add);
		}
		capped.sort(Comparator.comparingLong(LiquidityLevel::formedAt));
		return capped;
	}

	public record Params(int lookback, int swingWindow, double touchTolerance, double sweepTolerance,
			int maxLevelsPerSide) {
	}
}
