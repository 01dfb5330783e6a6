package com.smc.strategy;

import java.util.List;
import java.util.Map;

import com.smc.market.Horizon;

public record SignalProposal(
		String symbol,
		Direction direction,
		OrderKind orderKind,
		double entry,
		double stop,
		double target,
		double rewardRisk,
		double confidence,
		SetupType setup,
		List<String> rationale,
		Map<Horizon, Trend> timeframeBias,
		long timestamp) {

	public SignalProposal {
		rationale = List.copyOf(rationale);
		timeframeBias = Map.copyOf(timeframeBias);
	}
}
