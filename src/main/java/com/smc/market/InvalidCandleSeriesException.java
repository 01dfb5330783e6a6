package com.smc.market;

public class InvalidCandleSeriesException extends RuntimeException {

	private final Horizon horizon;
	private final int index;

	public InvalidCandleSeriesException(Horizon horizon, int index, String message) {
		super(message);
		this.horizon = horizon;
		this.index = index;
	}

	public Horizon horizon() {
		return horizon;
	}

	public int index() {
		return index;
	}
}
