package com.orderbook.error;

/**
 * Machine-readable reason attached to every {@link OrderBookException}.
 */
public enum ErrorCode {
    INVALID_ORDER,
    DUPLICATE_ORDER_ID,
    ORDER_NOT_FOUND,
    UNKNOWN_SYMBOL
}
