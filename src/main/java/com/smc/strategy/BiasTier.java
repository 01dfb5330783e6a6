package com.smc.strategy;

public enum BiasTier {
	AGREEMENT,
	WIDEST_PRIORITY,
	SECOND_FALLBACK,
	NONE
}
