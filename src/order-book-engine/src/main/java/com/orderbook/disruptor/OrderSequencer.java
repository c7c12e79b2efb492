package com.orderbook.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.orderbook.config.EngineConfig;
import com.orderbook.domain.BookSnapshot;
import com.orderbook.domain.Order;
import com.orderbook.domain.OrderBook;
import com.orderbook.domain.OrderId;
import com.orderbook.domain.Price;
import com.orderbook.domain.Trade;
import com.orderbook.error.InvalidOrderException;
import com.orderbook.logging.MatchingStats;
import com.orderbook.metrics.MetricsRegistry;
import com.orderbook.publishing.TradeListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Serializes every command for one instrument through an LMAX Disruptor.
 *
 * Any number of threads may call {@link #submit}, {@link #cancel} and
 * {@link #query}; slots are claimed with a CAS on the ring buffer and the
 * single consumer thread applies them to the book in sequence order. After
 * each command the consumer publishes a {@link BookSnapshot} through a
 * volatile field, before completing the caller's future, so
 * {@link #bestBid()} and {@link #bestAsk()} are lock-free and never see a
 * half-applied match.
 */
public class OrderSequencer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(OrderSequencer.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final String symbol;
    private final OrderBook book;
    private final Disruptor<OrderEvent> disruptor;
    private final RingBuffer<OrderEvent> ringBuffer;
    // publishers hold the read lock; start and close take the write lock
    private final ReentrantReadWriteLock lifecycleLock = new ReentrantReadWriteLock();
    private volatile BookSnapshot snapshot;
    private boolean started;
    private boolean closed;

    public OrderSequencer(String symbol, EngineConfig config, TradeListener listener,
                          MetricsRegistry metrics, MatchingStats stats) {
        this.symbol = symbol;
        this.book = new OrderBook(symbol);
        this.snapshot = BookSnapshot.empty(symbol);

        this.disruptor = new Disruptor<>(
                new OrderEventFactory(),
                config.getRingBufferSize(),
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                waitStrategy(config.getWaitStrategy())
        );
        Consumer<BookSnapshot> publisher = s -> this.snapshot = s;
        disruptor.handleEventsWith(new OrderEventHandler(
                book, publisher, listener, metrics, stats, config.isDetailedLogging()));
        this.ringBuffer = disruptor.getRingBuffer();
    }

    /**
     * Start the consumer thread. Commands are rejected until this is called.
     *
     * @throws IllegalStateException if the sequencer has been closed
     */
    public void start() {
        lifecycleLock.writeLock().lock();
        try {
            if (closed) {
                throw new IllegalStateException("Sequencer for " + symbol + " is closed");
            }
            if (started) {
                return;
            }
            disruptor.start();
            started = true;
        } finally {
            lifecycleLock.writeLock().unlock();
        }
        logger.info("Sequencer started for {}. Ring buffer size: {}",
                symbol, ringBuffer.getBufferSize());
    }

    /**
     * Queue an order for matching. The order's fields are copied; the
     * instance passed in is not modified.
     *
     * @return future completed with the trades in execution order, or
     *         exceptionally with the engine error that rejected the order
     */
    public CompletableFuture<List<Trade>> submit(Order order) {
        CompletableFuture<List<Trade>> future = new CompletableFuture<>();
        if (order == null) {
            future.completeExceptionally(new InvalidOrderException("Order must not be null"));
            return future;
        }
        long receivedNanos = System.nanoTime();
        publish(future, event ->
                OrderEventTranslator.translateAdd(event, order, future, receivedNanos));
        return future;
    }

    /**
     * Queue a cancel for a resting order.
     *
     * @return future completed with the cancelled order, or exceptionally with
     *         {@link com.orderbook.error.OrderNotFoundException}
     */
    public CompletableFuture<Order> cancel(OrderId orderId) {
        CompletableFuture<Order> future = new CompletableFuture<>();
        long receivedNanos = System.nanoTime();
        publish(future, event ->
                OrderEventTranslator.translateCancel(event, symbol, orderId, future, receivedNanos));
        return future;
    }

    /**
     * Run a read-only function against the book on the sequencer thread, in
     * order with all other commands. The function must not mutate the book
     * and should return a copy rather than live book state.
     */
    public <T> CompletableFuture<T> query(Function<OrderBook, T> reader) {
        CompletableFuture<T> future = new CompletableFuture<>();
        Runnable task = () -> {
            try {
                future.complete(reader.apply(book));
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        };
        long receivedNanos = System.nanoTime();
        publish(future, event ->
                OrderEventTranslator.translateQuery(event, symbol, task, receivedNanos));
        return future;
    }

    /**
     * Claim a slot and publish one command. Runs under the read lock so that
     * {@link #close()} cannot stop the consumer between the state check and
     * the publish; {@code tryNext} never blocks, so the lock is held briefly.
     */
    private void publish(CompletableFuture<?> future, Consumer<OrderEvent> translator) {
        lifecycleLock.readLock().lock();
        try {
            if (closed) {
                future.completeExceptionally(
                        new RejectedExecutionException("Sequencer for " + symbol + " is closed"));
                return;
            }
            if (!started) {
                future.completeExceptionally(
                        new RejectedExecutionException("Sequencer for " + symbol + " is not started"));
                return;
            }
            long sequence;
            try {
                sequence = ringBuffer.tryNext();
            } catch (InsufficientCapacityException e) {
                logger.warn("Ring buffer full for {}. Rejecting command", symbol);
                future.completeExceptionally(
                        new RejectedExecutionException("Ring buffer full for " + symbol));
                return;
            }

            try {
                translator.accept(ringBuffer.get(sequence));
            } finally {
                ringBuffer.publish(sequence);
            }
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    public Optional<Price> bestBid() {
        return snapshot.getBestBid();
    }

    public Optional<Price> bestAsk() {
        return snapshot.getBestAsk();
    }

    public BookSnapshot getSnapshot() {
        return snapshot;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Reject new commands, drain the ones already published and stop the
     * consumer thread. Commands accepted before this call complete, unless
     * the drain times out and the consumer is halted.
     */
    @Override
    public void close() {
        boolean running;
        lifecycleLock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            running = started;
        } finally {
            lifecycleLock.writeLock().unlock();
        }
        if (!running) {
            logger.info("Sequencer for {} closed before start.", symbol);
            return;
        }
        try {
            disruptor.shutdown(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            logger.info("Sequencer for {} shut down.", symbol);
        } catch (TimeoutException e) {
            logger.warn("Sequencer for {} did not drain within {}s, halting",
                    symbol, SHUTDOWN_TIMEOUT_SECONDS);
            disruptor.halt();
        }
    }

    private static WaitStrategy waitStrategy(EngineConfig.WaitStrategyType type) {
        switch (type) {
            case YIELDING:
                return new YieldingWaitStrategy();
            case BUSY_SPIN:
                return new BusySpinWaitStrategy();
            case BLOCKING:
            default:
                return new BlockingWaitStrategy();
        }
    }
}
