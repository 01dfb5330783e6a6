package com.smc.strategy;

public enum PriceLocation {
	PREMIUM,
	DISCOUNT,
	EQUILIBRIUM,
	UNKNOWN
}
