package com.smc.strategy;

public final class ScoreMath {

	public static final double RATIO_EPSILON = 1e-9;

	private ScoreMath() {
	}

	/**
	 * Inclusive threshold check that absorbs floating point error from decimal
	 * price arithmetic.
	 */
	public static boolean atLeast(double value, double threshold) {
		return value + RATIO_EPSILON >= threshold;
	}

	public static double clamp(double value, double min, double max) {
		return Math.max(min, Math.min(max, value));
	}

	public static double midpoint(double upper, double lower) {
		return (upper + lower) / 2.0;
	}

	public static boolean overlaps(double upperA, double lowerA, double upperB, double lowerB) {
		return Math.max(lowerA, lowerB) <= Math.min(upperA, upperB);
	}

	public static double distanceToRange(double price, double upper, double lower) {
		if (price > upper) {
			return price - upper;
		}
		if (price < lower) {
			return lower - price;
		}
		return 0.0;
	}
}
