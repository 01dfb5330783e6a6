package com.smc.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingDiagnosticSink implements DiagnosticSink {

	private static final Logger LOGGER = LoggerFactory.getLogger(LoggingDiagnosticSink.class);

	@Override
	public void publish(SmcLogV1.DiagnosticRecord record) {
		String line = SmcLogLineBuilder.build(record);
		if (record instanceof SmcLogV1.TimeframeFindingsLogDto) {
			LOGGER.debug(line);
		} else if (record instanceof SmcLogV1.InvalidBoundsLogDto
				|| record instanceof SmcLogV1.TimeframeUnavailableLogDto) {
			LOGGER.warn(line);
		} else {
			LOGGER.info(line);
		}
	}
}
