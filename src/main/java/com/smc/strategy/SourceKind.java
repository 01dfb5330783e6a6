package com.smc.strategy;

public enum SourceKind {
	GAP,
	ZONE,
	FLIPPED_ZONE
}
