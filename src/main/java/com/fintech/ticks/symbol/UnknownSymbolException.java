package com.fintech.ticks.symbol;

/**
 * Lookup of a symbol that is not in the tracked set.
 */
public class UnknownSymbolException extends RuntimeException {

    private final String symbol;

    public UnknownSymbolException(String symbol) {
        super("Symbol is not tracked: " + symbol);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
