package com.orderbook.error;

public class UnknownSymbolException extends OrderBookException {

    private final String symbol;

    public UnknownSymbolException(String symbol) {
        super(ErrorCode.UNKNOWN_SYMBOL, "Unknown symbol: " + symbol);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
