package com.smc.strategy.detectors;

import java.util.List;

public record LiquidityFindings(List<LiquidityLevel> levels, List<Sweep> sweeps) {

	public LiquidityFindings {
		levels = List.copyOf(levels);
		sweeps = List.copyOf(sweeps);
	}

	public static LiquidityFindings empty() {
		return new LiquidityFindings(List.of(), List.of());
	}

	public List<LiquidityLevel> unswept(LiquidityLevel.Side side) {
		return levels.stream()
				.filter(level -> level.side() == side && !level.swept())
				.toList();
	}
}
