package com.orderbook.domain;

/**
 * Order side. Buy orders rest on the bid side, sell orders on the ask side.
 */
public enum Side {
    BUY,
    SELL;

    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }
}
