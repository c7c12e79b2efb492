package com.orderbook.logging;

import com.orderbook.domain.Side;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Lock-free counters shared between the sequencer threads (writers) and the
 * periodic stats logger thread (reader). Uses AtomicLong for thread-safe
 * access without blocking the matching thread.
 */
public class MatchingStats {

    public final AtomicLong buyOrdersReceived = new AtomicLong();
    public final AtomicLong sellOrdersReceived = new AtomicLong();
    public final AtomicLong tradesExecuted = new AtomicLong();
    public final AtomicLong quantityTraded = new AtomicLong();
    public final AtomicLong ordersRejected = new AtomicLong();
    public final AtomicLong ordersCancelled = new AtomicLong();

    public void recordReceived(Side side) {
        if (side == Side.BUY) {
            buyOrdersReceived.incrementAndGet();
        } else if (side == Side.SELL) {
            sellOrdersReceived.incrementAndGet();
        }
    }

    public long totalOrdersReceived() {
        return buyOrdersReceived.get() + sellOrdersReceived.get();
    }

    /**
     * Point-in-time copy of every counter. Counters are read one by one, so a
     * copy taken while orders are flowing may be off by in-flight commands.
     */
    public Counts counts() {
        return new Counts(buyOrdersReceived.get(), sellOrdersReceived.get(),
                tradesExecuted.get(), quantityTraded.get(),
                ordersRejected.get(), ordersCancelled.get());
    }

    public record Counts(long buyOrders, long sellOrders, long trades,
                         long quantity, long rejected, long cancelled) {

        public static final Counts ZERO = new Counts(0, 0, 0, 0, 0, 0);

        public Counts minus(Counts earlier) {
            return new Counts(buyOrders - earlier.buyOrders, sellOrders - earlier.sellOrders,
                    trades - earlier.trades, quantity - earlier.quantity,
                    rejected - earlier.rejected, cancelled - earlier.cancelled);
        }

        public long orders() {
            return buyOrders + sellOrders;
        }

        public double tradesPerOrder() {
            long orders = orders();
            return orders > 0 ? (double) trades / orders : 0.0;
        }
    }
}
