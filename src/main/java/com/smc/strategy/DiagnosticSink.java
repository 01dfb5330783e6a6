package com.smc.strategy;

public interface DiagnosticSink {

	void publish(SmcLogV1.DiagnosticRecord record);
}
