package com.smc.market;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.smc.config.MarketProperties;

class CsvCandleSourceTest {

	@TempDir
	Path dataDir;

	@Test
	void loadsLatestCandlesSortedByCloseTime() throws IOException {
		Path dir = Files.createDirectories(dataDir.resolve("5m"));
		Files.writeString(dir.resolve("EURUSD.csv"), String.join("\n",
				"open_time,open,high,low,close,volume,close_time",
				"0,1.1010,1.1020,1.1000,1.1015,10,3000",
				"0,1.1000,1.1010,1.0990,1.1005,12,1000",
				"0,not-a-number,1.1010,1.0990,1.1005,12,1500",
				"0,1.1005,1.1015,1.0995,1.1010,11,2000",
				""));

		CsvCandleSource source = new CsvCandleSource(properties());
		List<Candle> candles = source.getCandles("EURUSD", Horizon.M5, 2);

		assertThat(candles).extracting(Candle::closeTime).containsExactly(2000L, 3000L);
		assertThat(candles.get(1).close()).isEqualTo(1.1015);
	}

	@Test
	void missingFileYieldsNoCandles() {
		CsvCandleSource source = new CsvCandleSource(properties());
		assertThat(source.getCandles("GBPUSD", Horizon.H4, 100)).isEmpty();
	}

	private MarketProperties properties() {
		return new MarketProperties("GMT", null, Map.of(), Map.of(), new MarketProperties.CsvSource(
				dataDir.toString(), "{symbol}.csv", ",", true, null, null, null, null, null, null, null,
				0, 0, 0, 0, 0, 0));
	}
}
