package com.orderbook.engine;

import com.orderbook.config.EngineConfig;
import com.orderbook.disruptor.OrderSequencer;
import com.orderbook.domain.BookLevel;
import com.orderbook.domain.BookSnapshot;
import com.orderbook.domain.Order;
import com.orderbook.domain.OrderId;
import com.orderbook.domain.Price;
import com.orderbook.domain.Trade;
import com.orderbook.error.InvalidOrderException;
import com.orderbook.error.UnknownSymbolException;
import com.orderbook.logging.MatchingStats;
import com.orderbook.logging.PeriodicStatsLogger;
import com.orderbook.metrics.MetricsRegistry;
import com.orderbook.publishing.TradeListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Entry point for callers: one independent {@link OrderSequencer} per
 * configured symbol. Books share no state, so different symbols match in
 * parallel while each symbol stays strictly sequential.
 *
 * Startup sequence:
 * 1. Create MetricsRegistry and start the Prometheus HTTP server if METRICS_PORT is set
 * 2. Create one sequencer (book + Disruptor) per symbol and start it
 * 3. Start the periodic stats logger if STATS_INTERVAL_SECONDS is positive
 */
public class MatchingEngine implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(MatchingEngine.class);

    private final EngineConfig config;
    private final Map<String, OrderSequencer> sequencers;
    private final MatchingStats stats;
    private final MetricsRegistry metrics;
    private final PeriodicStatsLogger statsLogger;
    private volatile boolean started;
    private volatile boolean closed;

    public MatchingEngine(EngineConfig config) {
        this(config, TradeListener.NO_OP);
    }

    public MatchingEngine(EngineConfig config, TradeListener listener) {
        this.config = config;
        this.stats = new MatchingStats();
        this.metrics = new MetricsRegistry();

        Map<String, OrderSequencer> bySymbol = new LinkedHashMap<>();
        for (String symbol : config.getSymbols()) {
            bySymbol.put(symbol, new OrderSequencer(symbol, config, listener, metrics, stats));
        }
        this.sequencers = Collections.unmodifiableMap(bySymbol);

        this.statsLogger = config.getStatsIntervalSeconds() > 0
                ? new PeriodicStatsLogger(stats, this::snapshots,
                        config.getEngineId(), config.getStatsIntervalSeconds())
                : null;
    }

    /**
     * Start the exporter, the sequencers and the stats logger. Commands sent
     * before this are rejected with {@link java.util.concurrent.RejectedExecutionException}.
     *
     * @throws UncheckedIOException if the metrics HTTP server cannot bind its port
     * @throws IllegalStateException if the engine has been closed
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Matching engine " + config.getEngineId() + " is closed");
        }
        if (started) {
            return;
        }
        logger.info("Starting matching engine. Configuration: {}", config);

        if (config.getMetricsPort() > 0) {
            try {
                metrics.startHttpServer(config.getMetricsPort());
                logger.info("Prometheus metrics HTTP server started on port {}",
                        config.getMetricsPort());
            } catch (IOException e) {
                throw new UncheckedIOException(
                        "Failed to start Prometheus HTTP server on port " + config.getMetricsPort(), e);
            }
        }

        for (OrderSequencer sequencer : sequencers.values()) {
            sequencer.start();
        }
        if (statsLogger != null) {
            statsLogger.start();
        }
        started = true;
        logger.info("Matching engine {} is ready. Symbols: {}",
                config.getEngineId(), sequencers.keySet());
    }

    /**
     * Route an order to its symbol's sequencer.
     *
     * @return future completed with the resulting trades, or exceptionally
     *         with an {@link com.orderbook.error.OrderBookException}
     */
    public CompletableFuture<List<Trade>> submit(Order order) {
        if (order == null) {
            return CompletableFuture.failedFuture(new InvalidOrderException("Order must not be null"));
        }
        OrderSequencer sequencer = sequencers.get(order.getSymbol());
        if (sequencer == null) {
            return CompletableFuture.failedFuture(new UnknownSymbolException(order.getSymbol()));
        }
        return sequencer.submit(order);
    }

    public CompletableFuture<Order> cancel(String symbol, OrderId orderId) {
        OrderSequencer sequencer = sequencers.get(symbol);
        if (sequencer == null) {
            return CompletableFuture.failedFuture(new UnknownSymbolException(symbol));
        }
        return sequencer.cancel(orderId);
    }

    /**
     * Blocking form of {@link #submit}: waits for the sequencer and rethrows
     * the engine exception directly.
     */
    public List<Trade> addOrder(Order order) {
        return await(submit(order));
    }

    /**
     * Blocking form of {@link #cancel}.
     */
    public Order cancelOrder(String symbol, OrderId orderId) {
        return await(cancel(symbol, orderId));
    }

    public Optional<Price> bestBid(String symbol) {
        return sequencer(symbol).bestBid();
    }

    public Optional<Price> bestAsk(String symbol) {
        return sequencer(symbol).bestAsk();
    }

    public BookSnapshot snapshot(String symbol) {
        return sequencer(symbol).getSnapshot();
    }

    /**
     * Best {@code depth} bid levels, read on the sequencer thread.
     */
    public List<BookLevel> bidLevels(String symbol, int depth) {
        return await(sequencer(symbol).query(book -> book.bidSnapshot(depth)));
    }

    public List<BookLevel> askLevels(String symbol, int depth) {
        return await(sequencer(symbol).query(book -> book.askSnapshot(depth)));
    }

    /**
     * Copy of the symbol's trade log, oldest first.
     */
    public List<Trade> trades(String symbol) {
        return await(sequencer(symbol).query(book -> List.copyOf(book.getTrades())));
    }

    public Set<String> symbols() {
        return sequencers.keySet();
    }

    public MatchingStats getStats() {
        return stats;
    }

    public MetricsRegistry getMetrics() {
        return metrics;
    }

    private Collection<BookSnapshot> snapshots() {
        List<BookSnapshot> all = new ArrayList<>(sequencers.size());
        for (OrderSequencer sequencer : sequencers.values()) {
            all.add(sequencer.getSnapshot());
        }
        return all;
    }

    private OrderSequencer sequencer(String symbol) {
        OrderSequencer sequencer = sequencers.get(symbol);
        if (sequencer == null) {
            throw new UnknownSymbolException(symbol);
        }
        return sequencer;
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        logger.info("Shutting down matching engine {}...", config.getEngineId());
        for (OrderSequencer sequencer : sequencers.values()) {
            try {
                sequencer.close();
            } catch (RuntimeException e) {
                logger.warn("Error shutting down sequencer {}: {}",
                        sequencer.getSymbol(), e.getMessage());
            }
        }
        if (statsLogger != null) {
            // Log final lifetime summary
            statsLogger.logShutdownSummary();
            statsLogger.stop();
        }
        metrics.close();
        logger.info("Matching engine {} shut down complete.", config.getEngineId());
    }
}
