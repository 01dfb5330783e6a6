package com.smc.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

public class LoggingProposalSink implements ProposalSink {

	private static final Logger LOGGER = LoggerFactory.getLogger(LoggingProposalSink.class);

	private final ObjectMapper objectMapper;

	public LoggingProposalSink(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	@Override
	public void accept(SignalProposal proposal) {
		try {
			LOGGER.info("EVENT=SIGNAL_PROPOSAL symbol={} json={}", proposal.symbol(),
					objectMapper.writeValueAsString(proposal));
		} catch (JsonProcessingException ex) {
			LOGGER.warn("EVENT=SIGNAL_PROPOSAL_SERIALIZE_FAIL symbol={} reason={}", proposal.symbol(),
					ex.getMessage());
		}
	}
}
