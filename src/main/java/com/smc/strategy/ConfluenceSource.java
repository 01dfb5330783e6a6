package com.smc.strategy;

import com.smc.market.Horizon;

public record ConfluenceSource(Horizon horizon, SourceKind kind) {

	public String tag() {
		return horizon.name() + "_" + kind.name();
	}
}
