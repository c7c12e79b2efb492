package com.orderbook.disruptor;

import com.orderbook.domain.Order;
import com.orderbook.domain.OrderId;
import com.orderbook.domain.Trade;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Copies a command into a pre-allocated OrderEvent slot.
 *
 * For ADD the caller's Order is copied field by field; the sequencer builds
 * its own Order from the slot, so the caller's instance is never mutated by
 * matching.
 */
public final class OrderEventTranslator {

    private OrderEventTranslator() {
    }

    public static void translateAdd(OrderEvent event, Order order,
                                    CompletableFuture<List<Trade>> future, long receivedNanos) {
        event.type = CommandType.ADD;
        event.receivedNanos = receivedNanos;
        event.orderId = order.getId() != null ? order.getId().value() : null;
        event.symbol = order.getSymbol();
        event.side = order.getSide();
        // a missing price is carried as 0 and rejected by the book
        event.price = order.getLimitPrice() != null ? order.getLimitPrice().cents() : 0;
        event.quantity = order.getRemainingQuantity();
        event.timestamp = order.getTimestamp();
        event.tradesFuture = future;
    }

    public static void translateCancel(OrderEvent event, String symbol, OrderId orderId,
                                       CompletableFuture<Order> future, long receivedNanos) {
        event.type = CommandType.CANCEL;
        event.receivedNanos = receivedNanos;
        event.symbol = symbol;
        event.orderId = orderId != null ? orderId.value() : null;
        event.cancelFuture = future;
    }

    public static void translateQuery(OrderEvent event, String symbol, Runnable query,
                                      long receivedNanos) {
        event.type = CommandType.QUERY;
        event.receivedNanos = receivedNanos;
        event.symbol = symbol;
        event.query = query;
    }
}
