package com.orderbook.error;

/**
 * Order failed validation before matching: missing fields, wrong symbol,
 * or a non-positive price or quantity.
 */
public class InvalidOrderException extends OrderBookException {

    public InvalidOrderException(String message) {
        super(ErrorCode.INVALID_ORDER, message);
    }
}
