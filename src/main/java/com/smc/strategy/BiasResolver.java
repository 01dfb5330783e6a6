package com.smc.strategy;

/**
 * Directional bias from the two widest horizons. A null trend means the horizon
 * is unavailable and counts as having no clear trend.
 */
public final class BiasResolver {

	private BiasResolver() {
	}

	public static BiasDecision resolve(Trend widest, Trend second) {
		boolean widestClear = widest != null && widest.clear();
		boolean secondClear = second != null && second.clear();
		if (widestClear && widest == second) {
			return new BiasDecision(Bias.of(widest.direction()), BiasTier.AGREEMENT, widest, second);
		}
		if (widestClear) {
			return new BiasDecision(Bias.of(widest.direction()), BiasTier.WIDEST_PRIORITY, widest, second);
		}
		if (secondClear) {
			return new BiasDecision(Bias.of(second.direction()), BiasTier.SECOND_FALLBACK, widest, second);
		}
		return new BiasDecision(Bias.NEUTRAL, BiasTier.NONE, widest, second);
	}
}
