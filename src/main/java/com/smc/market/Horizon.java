package com.smc.market;

import java.time.Duration;

/**
 * Analysis horizons ordered from widest to narrowest.
 */
public enum Horizon {
	H4(240, "4h"),
	H1(60, "1h"),
	M15(15, "15m"),
	M5(5, "5m");

	private final int minutes;
	private final String interval;

	Horizon(int minutes, String interval) {
		this.minutes = minutes;
		this.interval = interval;
	}

	public int minutes() {
		return minutes;
	}

	public String interval() {
		return interval;
	}

	public Duration duration() {
		return Duration.ofMinutes(minutes);
	}

	public boolean widerThan(Horizon other) {
		return ordinal() < other.ordinal();
	}

	public static Horizon widest() {
		return H4;
	}

	public static Horizon secondWidest() {
		return H1;
	}

	public static Horizon narrowest() {
		return M5;
	}
}
