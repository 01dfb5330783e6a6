package com.smc.strategy.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.smc.market.Horizon;
import com.smc.strategy.detectors.LiquidityLevel;
import com.smc.strategy.detectors.Sweep;

class SweepLogTest {

	@Test
	void duplicatesAreIgnored() {
		SweepLog log = new SweepLog(10);
		Sweep sweep = sweep(1.1000, 1_000L);

		assertEquals(1, log.record("EURUSD", List.of(sweep)));
		assertEquals(0, log.record("EURUSD", List.of(sweep)));
		assertThat(log.all("EURUSD")).containsExactly(sweep);
	}

	@Test
	void oldestEntriesArePrunedBeyondCapacity() {
		SweepLog log = new SweepLog(2);
		Sweep first = sweep(1.1000, 1_000L);
		Sweep second = sweep(1.1010, 2_000L);
		Sweep third = sweep(1.1020, 3_000L);

		log.record("EURUSD", List.of(second, first));
		log.record("EURUSD", List.of(third));

		assertThat(log.all("EURUSD")).containsExactly(second, third);
	}

	@Test
	void sinceFiltersByConfirmTimeAndSymbol() {
		SweepLog log = new SweepLog(10);
		log.record("EURUSD", List.of(sweep(1.1000, 1_000L), sweep(1.1010, 5_000L)));

		assertThat(log.since("EURUSD", 2_000L)).extracting(Sweep::levelPrice).containsExactly(1.1010);
		assertThat(log.since("GBPUSD", 0L)).isEmpty();
	}

	private static Sweep sweep(double level, long time) {
		return new Sweep(Horizon.M15, LiquidityLevel.Side.UPPER, level, level + 0.0012, time, time);
	}
}
