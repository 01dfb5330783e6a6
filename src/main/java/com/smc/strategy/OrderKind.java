package com.smc.strategy;

public enum OrderKind {
	LIMIT_ABOVE,
	LIMIT_BELOW,
	STOP_ABOVE,
	STOP_BELOW
}
