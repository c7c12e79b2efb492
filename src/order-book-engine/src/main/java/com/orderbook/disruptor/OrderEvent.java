package com.orderbook.disruptor;

import com.orderbook.domain.Order;
import com.orderbook.domain.Side;
import com.orderbook.domain.Trade;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Pre-allocated mutable event object in the Disruptor ring buffer.
 *
 * Fields are public for zero-overhead access on the critical path.
 * The clear() method resets all fields to defaults after processing,
 * preventing stale data in the ring buffer slot.
 */
public class OrderEvent {

    public CommandType type;
    public long receivedNanos;     // System.nanoTime() when the command was submitted
    public String orderId;
    public String symbol;
    public Side side;
    public long price;             // cents
    public long quantity;
    public long timestamp;         // epoch millis

    public CompletableFuture<List<Trade>> tradesFuture;
    public CompletableFuture<Order> cancelFuture;
    public Runnable query;

    /**
     * Reset all fields to defaults. Called after the event has been processed
     * to prevent stale data from persisting in the ring buffer slot.
     */
    public void clear() {
        type = null;
        receivedNanos = 0;
        orderId = null;
        symbol = null;
        side = null;
        price = 0;
        quantity = 0;
        timestamp = 0;
        tradesFuture = null;
        cancelFuture = null;
        query = null;
    }
}
