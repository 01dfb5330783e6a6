package com.smc.strategy;

public record SignalDecision(SignalProposal proposal, String reason, Double rewardRisk, Double confidence) {

	public static final String REASON_EMITTED = "EMITTED";
	public static final String REASON_MARKET_CLOSED = "MARKET_CLOSED";
	public static final String REASON_UNRESOLVED_SYMBOL = "UNRESOLVED_SYMBOL";
	public static final String REASON_NO_DATA = "NO_DATA";
	public static final String REASON_NEUTRAL_BIAS = "NEUTRAL_BIAS";
	public static final String REASON_NO_CANDIDATE = "NO_CANDIDATE";
	public static final String REASON_INVALID_RISK = "INVALID_RISK";
	public static final String REASON_NO_TARGET = "NO_TARGET";
	public static final String REASON_RR_BELOW_MIN = "RR_BELOW_MIN";
	public static final String REASON_LOW_CONFIDENCE = "LOW_CONFIDENCE";

	public static SignalDecision emitted(SignalProposal proposal) {
		return new SignalDecision(proposal, REASON_EMITTED, proposal.rewardRisk(), proposal.confidence());
	}

	public static SignalDecision rejected(String reason) {
		return new SignalDecision(null, reason, null, null);
	}

	public static SignalDecision rejected(String reason, Double rewardRisk, Double confidence) {
		return new SignalDecision(null, reason, rewardRisk, confidence);
	}

	public boolean accepted() {
		return proposal != null;
	}
}
