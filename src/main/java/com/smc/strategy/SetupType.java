package com.smc.strategy;

public enum SetupType {
	CONFLUENCE,
	GAP,
	ZONE,
	FLIPPED_ZONE;

	public static SetupType of(SourceKind kind) {
		return switch (kind) {
			case GAP -> GAP;
			case ZONE -> ZONE;
			case FLIPPED_ZONE -> FLIPPED_ZONE;
		};
	}
}
