package com.smc.market;

public class CandleSourceException extends RuntimeException {

	public CandleSourceException(String message, Throwable cause) {
		super(message, cause);
	}
}
