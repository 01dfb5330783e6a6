package com.smc.strategy.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.smc.market.Candle;
import com.smc.market.Horizon;
import com.smc.strategy.detectors.Gap;
import com.smc.strategy.detectors.GapDetector;

/**
 * Fill tracking that outlives the candle window. A gap that has been marked
 * filled is never reopened, and filled gaps are dropped once the retention
 * window after their fill has elapsed.
 */
public class GapLedger {

	private final Map<CacheKey, Book> books = new ConcurrentHashMap<>();
	private final Duration retention;
	private final int maxTracked;

	public GapLedger(Duration retention, int maxTracked) {
		this.retention = retention;
		this.maxTracked = maxTracked;
	}

	public List<Gap> merge(CacheKey key, List<Gap> detected, List<Candle> candles, Instant now) {
		return books.computeIfAbsent(key, ignored -> new Book()).merge(detected, candles, now);
	}

	/**
	 * Runs the fill scan of the symbol's wider horizon books over candles of
	 * {@code source}, so price seen on a narrow horizon fills gaps between
	 * refreshes of the wider ones.
	 */
	public void scanFills(String symbol, Horizon source, List<Candle> candles, Instant now) {
		books.forEach((key, book) -> {
			if (key.symbol().equals(symbol) && key.horizon().widerThan(source)) {
				book.scanFills(candles, now);
			}
		});
	}

	public List<Gap> snapshot(CacheKey key) {
		Book book = books.get(key);
		return book == null ? List.of() : book.snapshot();
	}

	public Optional<List<Gap>> tracked(CacheKey key) {
		Book book = books.get(key);
		return book == null ? Optional.empty() : Optional.of(book.snapshot());
	}

	private final class Book {
		private final Map<Gap.Key, Gap> gaps = new LinkedHashMap<>();

		synchronized List<Gap> merge(List<Gap> detected, List<Candle> candles, Instant now) {
			for (Gap gap : detected) {
				Gap existing = gaps.get(gap.key());
				if (existing == null || (!existing.filled() && gap.filled())) {
					gaps.put(gap.key(), gap);
				}
			}
			scanFills(candles, now);
			return snapshot();
		}

		synchronized void scanFills(List<Candle> candles, Instant now) {
			List<Gap> open = gaps.values().stream().filter(gap -> !gap.filled()).toList();
			for (Gap gap : GapDetector.scanFills(open, candles)) {
				gaps.put(gap.key(), gap);
			}
			purge(now);
		}

		synchronized List<Gap> snapshot() {
			List<Gap> ordered = new ArrayList<>(gaps.values());
			ordered.sort(Comparator.comparingLong(Gap::createdAt));
			return List.copyOf(ordered);
		}

		private void purge(Instant now) {
			long cutoff = now.minus(retention).toEpochMilli();
			gaps.values().removeIf(gap -> gap.filled() && gap.filledAt() != null && gap.filledAt() < cutoff);
			if (maxTracked > 0 && gaps.size() > maxTracked) {
				List<Gap> ordered = new ArrayList<>(gaps.values());
				ordered.sort(Comparator.comparing(Gap::filled).reversed().thenComparingLong(Gap::createdAt));
				Iterator<Gap> iterator = ordered.iterator();
				while (gaps.size() > maxTracked && iterator.hasNext()) {
					gaps.remove(iterator.next().key());
				}
			}
		}
	}
}
