package com.smc.market;

public record Candle(double open, double high, double low, double close, double volume, long closeTime) {

	public boolean bullish() {
		return close > open;
	}

	public boolean bearish() {
		return close < open;
	}

	public double body() {
		return Math.abs(close - open);
	}

	public double range() {
		return high - low;
	}
}
