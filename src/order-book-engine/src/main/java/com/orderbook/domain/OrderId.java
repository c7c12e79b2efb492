package com.orderbook.domain;

/**
 * Value object wrapping a caller-assigned order identifier.
 * The engine never generates ids; it only checks them for collisions.
 */
public record OrderId(String value) {

    @Override
    public String toString() {
        return value;
    }
}
