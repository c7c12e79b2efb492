package com.orderbook.disruptor;

import com.lmax.disruptor.EventHandler;
import com.orderbook.domain.BookSnapshot;
import com.orderbook.domain.Order;
import com.orderbook.domain.OrderBook;
import com.orderbook.domain.OrderId;
import com.orderbook.domain.Price;
import com.orderbook.domain.Trade;
import com.orderbook.error.OrderBookException;
import com.orderbook.logging.MatchingStats;
import com.orderbook.metrics.MetricsRegistry;
import com.orderbook.publishing.TradeListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * The single-threaded event processor for one instrument.
 *
 * This handler runs on a SINGLE thread managed by the Disruptor's BatchEventProcessor
 * and is the only code that touches its OrderBook. All operations inside onEvent()
 * are sequential. No locks, no blocking I/O.
 *
 * Processing pipeline per ADD event:
 * 1. Rebuild an Order from the slot
 * 2. Match and rest it (the book validates first; rejections leave it untouched)
 * 3. Publish a fresh BookSnapshot for lock-free readers
 * 4. Notify the TradeListener
 * 5. Record metrics and stats
 * 6. Complete the caller's future
 */
public class OrderEventHandler implements EventHandler<OrderEvent> {

    private static final Logger logger = LoggerFactory.getLogger(OrderEventHandler.class);

    private final OrderBook book;
    private final Consumer<BookSnapshot> snapshotPublisher;
    private final TradeListener listener;
    private final MetricsRegistry metrics;
    private final MatchingStats stats;
    private final boolean detailedLogging;

    public OrderEventHandler(OrderBook book,
                             Consumer<BookSnapshot> snapshotPublisher,
                             TradeListener listener,
                             MetricsRegistry metrics,
                             MatchingStats stats,
                             boolean detailedLogging) {
        this.book = book;
        this.snapshotPublisher = snapshotPublisher;
        this.listener = listener;
        this.metrics = metrics;
        this.stats = stats;
        this.detailedLogging = detailedLogging;
    }

    @Override
    public void onEvent(OrderEvent event, long sequence, boolean endOfBatch) {
        if (event.type == null) {
            // Slot was cleared or never populated -- skip
            return;
        }

        try {
            switch (event.type) {
                case ADD:
                    handleAdd(event, sequence);
                    break;
                case CANCEL:
                    handleCancel(event, sequence);
                    break;
                case QUERY:
                    event.query.run();
                    break;
                default:
                    throw new IllegalStateException("Unhandled command type " + event.type);
            }
        } finally {
            // Clear the event slot to prevent stale data
            event.clear();
        }
    }

    private void handleAdd(OrderEvent event, long sequence) {
        String symbol = book.getSymbol();
        String sideLabel = event.side != null ? event.side.name().toLowerCase(Locale.ROOT) : "unknown";
        stats.recordReceived(event.side);
        metrics.ordersReceivedTotal.labelValues(symbol, sideLabel).inc();

        Order order = new Order(
                new OrderId(event.orderId),
                event.symbol,
                event.side,
                new Price(event.price),
                event.quantity,
                event.timestamp
        );

        List<Trade> trades;
        try {
            trades = book.addOrder(order);
        } catch (OrderBookException e) {
            recordRejection(e, "add", event.orderId);
            publishSnapshot(sequence);
            event.tradesFuture.completeExceptionally(e);
            return;
        } catch (RuntimeException e) {
            logger.error("Error processing order {} at sequence {}: {}",
                    event.orderId, sequence, e.getMessage(), e);
            publishSnapshot(sequence);
            event.tradesFuture.completeExceptionally(e);
            return;
        }

        publishSnapshot(sequence);

        long filled = 0;
        for (Trade trade : trades) {
            filled += trade.getQuantity();
            if (detailedLogging) {
                logger.debug("Trade executed",
                        keyValue("event", "TRADE"),
                        keyValue("symbol", symbol),
                        keyValue("tradeId", trade.getTradeId()),
                        keyValue("maker", trade.getMakerOrderId().value()),
                        keyValue("taker", trade.getTakerOrderId().value()),
                        keyValue("price", trade.getPrice().cents()),
                        keyValue("quantity", trade.getQuantity()));
            }
            notifyListener(() -> listener.onTrade(trade), "onTrade");
        }
        if (!order.isFilled()) {
            notifyListener(() -> listener.onOrderRested(order), "onOrderRested");
        }

        stats.tradesExecuted.addAndGet(trades.size());
        stats.quantityTraded.addAndGet(filled);
        metrics.tradesTotal.labelValues(symbol).inc(trades.size());
        metrics.tradedQuantityTotal.labelValues(symbol).inc(filled);
        metrics.matchDuration.labelValues(symbol, "add")
                .observe(nanosToSeconds(System.nanoTime() - event.receivedNanos));

        event.tradesFuture.complete(trades);
    }

    private void handleCancel(OrderEvent event, long sequence) {
        String symbol = book.getSymbol();
        Order cancelled;
        try {
            cancelled = book.cancelOrder(new OrderId(event.orderId));
        } catch (OrderBookException e) {
            recordRejection(e, "cancel", event.orderId);
            publishSnapshot(sequence);
            event.cancelFuture.completeExceptionally(e);
            return;
        } catch (RuntimeException e) {
            logger.error("Error cancelling order {} at sequence {}: {}",
                    event.orderId, sequence, e.getMessage(), e);
            publishSnapshot(sequence);
            event.cancelFuture.completeExceptionally(e);
            return;
        }

        publishSnapshot(sequence);
        notifyListener(() -> listener.onOrderCancelled(cancelled), "onOrderCancelled");

        stats.ordersCancelled.incrementAndGet();
        metrics.cancelsTotal.labelValues(symbol).inc();
        metrics.matchDuration.labelValues(symbol, "cancel")
                .observe(nanosToSeconds(System.nanoTime() - event.receivedNanos));

        event.cancelFuture.complete(cancelled);
    }

    private void recordRejection(OrderBookException e, String command, String orderId) {
        stats.ordersRejected.incrementAndGet();
        metrics.rejectionsTotal.labelValues(book.getSymbol(),
                e.getCode().name().toLowerCase(Locale.ROOT)).inc();
        if (detailedLogging) {
            logger.warn("Command rejected",
                    keyValue("event", "REJECTED"),
                    keyValue("symbol", book.getSymbol()),
                    keyValue("command", command),
                    keyValue("orderId", orderId),
                    keyValue("reason", e.getCode()),
                    keyValue("message", e.getMessage()));
        }
    }

    private void publishSnapshot(long sequence) {
        BookSnapshot snapshot = book.snapshot(sequence);
        snapshotPublisher.accept(snapshot);
        metrics.recordBook(snapshot);
    }

    private void notifyListener(Runnable callback, String callbackName) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.error("TradeListener.{} failed for {}: {}",
                    callbackName, book.getSymbol(), e.getMessage(), e);
        }
    }

    private static double nanosToSeconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }
}
