package com.smc.strategy;

public interface ProposalSink {

	void accept(SignalProposal proposal);
}
