package com.orderbook.domain;

import java.util.List;

/**
 * Outcome of matching one incoming order: the fills in execution order and
 * whether anything is left to rest.
 */
public record MatchResultSet(List<Trade> trades, boolean incomingFullyFilled) {
}
