package com.smc.market;

import java.util.Optional;

public interface SymbolResolver {

	Optional<String> resolve(String symbol);
}
