package com.orderbook.publishing;

import com.orderbook.domain.Order;
import com.orderbook.domain.Trade;

/**
 * Callback seam for the collaborators that journal trades and notify clients.
 *
 * Called on the sequencer thread after the book has been updated and before
 * the submitting caller's future completes. Implementations must not block
 * and must not call back into the engine. A listener that throws is logged
 * and otherwise ignored; the book and the caller's result are unaffected.
 */
public interface TradeListener {

    TradeListener NO_OP = new TradeListener() {
    };

    default void onTrade(Trade trade) {
    }

    /**
     * An order's unfilled remainder was added to the book.
     */
    default void onOrderRested(Order order) {
    }

    default void onOrderCancelled(Order order) {
    }
}
