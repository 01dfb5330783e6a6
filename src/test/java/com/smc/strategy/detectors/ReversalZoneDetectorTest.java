package com.smc.strategy.detectors;

import static com.smc.strategy.StrategyFixtures.candle;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.smc.market.Candle;
import com.smc.market.Horizon;
import com.smc.strategy.Direction;
import com.smc.strategy.SourceKind;

class ReversalZoneDetectorTest {

	private static final ReversalZoneDetector.Params PARAMS = new ReversalZoneDetector.Params(3, 5.0, 5, 1.0);

	@Test
	void lastOpposingCandleBeforeImpulseBecomesZone() {
		ZoneFindings findings = ReversalZoneDetector.detect(Horizon.H1, impulse(), PARAMS);

		assertEquals(1, findings.zones().size());
		Zone zone = findings.zones().get(0);
		assertEquals(Direction.BULLISH, zone.direction());
		assertEquals(101.0, zone.upper());
		assertEquals(98.0, zone.lower());
		assertEquals(99.5, zone.entryLevel());
		assertEquals(4_000L, zone.createdAt());
		assertEquals(0, zone.sourceIndex());
		assertEquals(6.5 / 3.0, zone.strength(), 1e-9);
		assertTrue(zone.valid());
		assertTrue(findings.flippedZones().isEmpty());
	}

	@Test
	void shortOrWeakRunProducesNoZone() {
		ReversalZoneDetector.Params strict = new ReversalZoneDetector.Params(3, 7.0, 5, 1.0);
		assertTrue(ReversalZoneDetector.detect(Horizon.H1, impulse(), strict).zones().isEmpty());
		ReversalZoneDetector.Params longer = new ReversalZoneDetector.Params(4, 5.0, 5, 1.0);
		assertTrue(ReversalZoneDetector.detect(Horizon.H1, impulse(), longer).zones().isEmpty());
	}

	@Test
	void closeThroughZoneFlipsItExactlyOnce() {
		List<Candle> candles = new ArrayList<>(impulse());
		candles.add(candle(105.5, 105.5, 100, 100.5, 5_000L));
		candles.add(candle(100.5, 101, 96, 97, 6_000L));
		candles.add(candle(97, 98.5, 96.5, 97.5, 7_000L));

		ZoneFindings findings = ReversalZoneDetector.detect(Horizon.H1, candles, PARAMS);

		assertFalse(findings.zones().get(0).valid());
		assertEquals(1, findings.flippedZones().size());
		FlippedZone flipped = findings.flippedZones().get(0);
		assertEquals(Direction.BEARISH, flipped.direction());
		assertEquals(101.0, flipped.upper());
		assertEquals(98.0, flipped.lower());
		assertEquals(6_000L, flipped.flippedAt());
		assertEquals(SourceKind.FLIPPED_ZONE, flipped.kind());
		assertThat(findings.active()).containsExactly(flipped);

		assertEquals(1, findings.retests().size());
		assertEquals(flipped, findings.retests().get(0).zone());
		assertEquals(7_000L, findings.retests().get(0).candleTime());

		candles.add(candle(97.5, 97.6, 94, 94.5, 8_000L));
		assertEquals(1, ReversalZoneDetector.detect(Horizon.H1, candles, PARAMS).flippedZones().size());
	}

	@Test
	void invalidatedZoneCannotFlipAgain() {
		Zone zone = new Zone(Horizon.M15, Direction.BEARISH, 10, 8, 1L, 1.0, 0, true);
		Zone.Flip flip = zone.flip(2L);
		assertEquals(Direction.BULLISH, flip.flipped().direction());
		assertThrows(IllegalStateException.class, () -> flip.invalidated().flip(3L));
	}

	@Test
	void originWithInvertedBoundsIsRejected() {
		List<Candle> candles = new ArrayList<>(impulse());
		candles.set(0, candle(100, 98, 101, 99, 1_000L));

		ZoneFindings findings = ReversalZoneDetector.detect(Horizon.H1, candles, PARAMS);

		assertTrue(findings.zones().isEmpty());
		assertEquals(1, findings.rejected().size());
		assertEquals(ReversalZoneDetector.REJECT_INVALID_BOUNDS, findings.rejected().get(0).reason());
	}

	@Test
	void detectionIsIdempotent() {
		List<Candle> candles = new ArrayList<>(impulse());
		candles.add(candle(105.5, 105.5, 100, 100.5, 5_000L));
		candles.add(candle(100.5, 101, 96, 97, 6_000L));
		assertEquals(ReversalZoneDetector.detect(Horizon.H1, candles, PARAMS),
				ReversalZoneDetector.detect(Horizon.H1, candles, PARAMS));
	}

	private static List<Candle> impulse() {
		return List.of(
				candle(100, 101, 98, 99, 1_000L),
				candle(99, 102, 99, 101.5, 2_000L),
				candle(101.5, 104, 101, 103.5, 3_000L),
				candle(103.5, 106, 103, 105.5, 4_000L));
	}
}
