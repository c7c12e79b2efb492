package com.orderbook.matching;

import com.orderbook.domain.MatchResultSet;
import com.orderbook.domain.Order;
import com.orderbook.domain.OrderBook;

/**
 * Interface for order matching algorithms.
 * The matching algorithm takes an order book and an already validated
 * incoming order, consumes resting liquidity, and returns the set of fills
 * produced. Resting the remainder is left to the book.
 */
public interface MatchingAlgorithm {
    MatchResultSet match(OrderBook book, Order incomingOrder);
}
