package com.smc.strategy.cache;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.smc.strategy.detectors.Sweep;

/**
 * Chronological sweeps per symbol, bounded in size with the oldest pruned first.
 */
public class SweepLog {

	private final Map<String, History> histories = new ConcurrentHashMap<>();
	private final int capacity;

	public SweepLog(int capacity) {
		this.capacity = Math.max(1, capacity);
	}

	public int record(String symbol, List<Sweep> sweeps) {
		if (sweeps == null || sweeps.isEmpty()) {
			return 0;
		}
		return histories.computeIfAbsent(symbol, ignored -> new History()).addAll(sweeps);
	}

	public List<Sweep> since(String symbol, long cutoffTime) {
		History history = histories.get(symbol);
		return history == null ? List.of() : history.since(cutoffTime);
	}

	public List<Sweep> all(String symbol) {
		return since(symbol, Long.MIN_VALUE);
	}

	private final class History {
		private final Deque<Sweep> entries = new ArrayDeque<>();

		synchronized int addAll(List<Sweep> sweeps) {
			int added = 0;
			for (Sweep sweep : sweeps) {
				if (entries.contains(sweep)) {
					continue;
				}
				insert(sweep);
				added++;
			}
			while (entries.size() > capacity) {
				entries.removeFirst();
			}
			return added;
		}

		synchronized List<Sweep> since(long cutoffTime) {
			List<Sweep> result = new ArrayList<>();
			for (Sweep sweep : entries) {
				if (sweep.confirmTime() >= cutoffTime) {
					result.add(sweep);
				}
			}
			return result;
		}

		private void insert(Sweep sweep) {
			if (entries.isEmpty() || entries.peekLast().confirmTime() <= sweep.confirmTime()) {
				entries.addLast(sweep);
				return;
			}
			List<Sweep> ordered = new ArrayList<>(entries);
			int index = 0;
			while (index < ordered.size() && ordered.get(index).confirmTime() <= sweep.confirmTime()) {
				index++;
			}
			ordered.add(index, sweep);
			entries.clear();
			entries.addAll(ordered);
		}
	}
}
