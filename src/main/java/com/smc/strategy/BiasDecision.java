package com.smc.strategy;

public record BiasDecision(Bias bias, BiasTier tier, Trend widest, Trend second) {
}
