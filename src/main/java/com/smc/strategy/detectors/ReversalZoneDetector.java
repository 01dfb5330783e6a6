package com.smc.strategy.detectors;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.smc.market.Candle;
import com.smc.market.Horizon;
import com.smc.strategy.Direction;

public final class ReversalZoneDetector {

	public static final String REJECT_INVALID_BOUNDS = "INVALID_BOUNDS";

	private ReversalZoneDetector() {
	}

	public static ZoneFindings detect(Horizon horizon, List<Candle> candles, Params params) {
		if (candles == null || candles.size() < params.minRunLength() + 1) {
			return ZoneFindings.empty();
		}
		List<Zone> zones = new ArrayList<>();
		List<FlippedZone> flipped = new ArrayList<>();
		List<ZoneFindings.Rejected> rejected = new ArrayList<>();
		Set<Integer> usedOrigins = new HashSet<>();

		int i = 0;
		while (i < candles.size()) {
			Direction runDirection = bodyDirection(candles.get(i));
			if (runDirection == null) {
				i++;
				continue;
			}
			int end = i;
			double magnitude = candles.get(i).body();
			while (end + 1 < candles.size() && bodyDirection(candles.get(end + 1)) == runDirection) {
				end++;
				magnitude += candles.get(end).body();
			}
			int runLength = end - i + 1;
			if (runLength >= params.minRunLength() && magnitude > params.minMove()) {
				int origin = findOrigin(candles, i, runDirection, params.originLookback());
				if (origin >= 0 && usedOrigins.add(origin)) {
					Candle originCandle = candles.get(origin);
					if (originCandle.high() < originCandle.low()) {
						rejected.add(new ZoneFindings.Rejected(horizon, origin, originCandle.high(), originCandle.low(),
								REJECT_INVALID_BOUNDS));
					} else {
						double strength = magnitude / Math.max(originCandle.range(), params.pointSize());
						Zone zone = new Zone(horizon, runDirection, originCandle.high(), originCandle.low(),
								candles.get(end).closeTime(), strength, origin, true);
						settle(zone, candles, end + 1, zones, flipped);
					}
				}
			}
			i = end + 1;
		}
		return new ZoneFindings(zones, flipped, retests(candles, zones, flipped), rejected);
	}

	private static void settle(Zone zone, List<Candle> candles, int from, List<Zone> zones,
			List<FlippedZone> flipped) {
		for (int m = from; m < candles.size(); m++) {
			Candle candle = candles.get(m);
			if (zone.invalidatedBy(candle)) {
				Zone.Flip flip = zone.flip(candle.closeTime());
				zones.add(flip.invalidated());
				flipped.add(flip.flipped());
				return;
			}
		}
		zones.add(zone);
	}

	private static int findOrigin(List<Candle> candles, int runStart, Direction runDirection, int lookback) {
		int floor = Math.max(0, runStart - Math.max(1, lookback));
		for (int k = runStart - 1; k >= floor; k--) {
			if (bodyDirection(candles.get(k)) == runDirection.opposite()) {
				return k;
			}
		}
		return -1;
	}

	private static List<ZoneFindings.Retest> retests(List<Candle> candles, List<Zone> zones,
			List<FlippedZone> flipped) {
		Candle latest = candles.get(candles.size() - 1);
		List<ZoneFindings.Retest> retests = new ArrayList<>();
		for (Zone zone : zones) {
			if (zone.valid() && touches(zone, latest)) {
				retests.add(new ZoneFindings.Retest(zone, latest.closeTime()));
			}
		}
		for (FlippedZone zone : flipped) {
			if (touches(zone, latest)) {
				retests.add(new ZoneFindings.Retest(zone, latest.closeTime()));
			}
		}
		return retests;
	}

	private static boolean touches(ReversalZone zone, Candle candle) {
		return zone.formedAt() < candle.closeTime()
				&& candle.low() <= zone.upper()
				&& candle.high() >= zone.lower();
	}

	private static Direction bodyDirection(Candle candle) {
		if (candle.bullish()) {
			return Direction.BULLISH;
		}
		if (candle.bearish()) {
			return Direction.BEARISH;
		}
		return null;
	}

	public record Params(int minRunLength, double minMove, int originLookback, double pointSize) {
	}
}
