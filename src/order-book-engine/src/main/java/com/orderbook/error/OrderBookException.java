package com.orderbook.error;

/**
 * Base class for every error the engine reports to its caller.
 *
 * All of them are local and recoverable: the book is left exactly as it was
 * before the rejected call.
 */
public abstract class OrderBookException extends RuntimeException {

    private final ErrorCode code;

    protected OrderBookException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
