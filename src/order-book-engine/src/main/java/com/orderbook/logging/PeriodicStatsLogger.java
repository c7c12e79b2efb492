package com.orderbook.logging;

import com.orderbook.domain.BookSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * Logs engine-wide throughput and per-symbol top of book on a daemon thread.
 * Book state is read from the snapshots the sequencers publish, so the
 * matching threads are never touched.
 */
public class PeriodicStatsLogger {

    private static final Logger logger = LoggerFactory.getLogger(PeriodicStatsLogger.class);

    private final MatchingStats stats;
    private final Supplier<Collection<BookSnapshot>> snapshots;
    private final String engineId;
    private final int intervalSeconds;
    private final ScheduledExecutorService scheduler;

    // only touched from the scheduler thread
    private MatchingStats.Counts previous = MatchingStats.Counts.ZERO;

    public PeriodicStatsLogger(MatchingStats stats, Supplier<Collection<BookSnapshot>> snapshots,
                               String engineId, int intervalSeconds) {
        this.stats = stats;
        this.snapshots = snapshots;
        this.engineId = engineId;
        this.intervalSeconds = intervalSeconds;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "stats-" + engineId);
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        scheduler.scheduleAtFixedRate(this::logSummary, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        logger.info("Stats logger started",
                keyValue("event", "STATS_LOGGER_STARTED"),
                keyValue("engine", engineId),
                keyValue("intervalSeconds", intervalSeconds));
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Lifetime totals, logged once when the engine closes.
     */
    public void logShutdownSummary() {
        MatchingStats.Counts total = stats.counts();
        logger.info("Lifetime summary",
                keyValue("event", "SHUTDOWN_SUMMARY"),
                keyValue("engine", engineId),
                keyValue("buyOrders", total.buyOrders()),
                keyValue("sellOrders", total.sellOrders()),
                keyValue("trades", total.trades()),
                keyValue("quantityTraded", total.quantity()),
                keyValue("rejected", total.rejected()),
                keyValue("cancelled", total.cancelled()),
                keyValue("tradesPerOrder", ratio(total.tradesPerOrder())));
    }

    void logSummary() {
        try {
            MatchingStats.Counts current = stats.counts();
            MatchingStats.Counts window = current.minus(previous);
            previous = current;

            logger.info("Interval summary",
                    keyValue("event", "PERIODIC_SUMMARY"),
                    keyValue("engine", engineId),
                    keyValue("intervalSeconds", intervalSeconds),
                    keyValue("orders", window.orders()),
                    keyValue("trades", window.trades()),
                    keyValue("quantityTraded", window.quantity()),
                    keyValue("rejected", window.rejected()),
                    keyValue("cancelled", window.cancelled()),
                    keyValue("tradesPerOrder", ratio(window.tradesPerOrder())));

            for (BookSnapshot book : snapshots.get()) {
                logger.info("Book summary",
                        keyValue("event", "BOOK_SUMMARY"),
                        keyValue("engine", engineId),
                        keyValue("symbol", book.getSymbol()),
                        keyValue("bestBid", book.getBestBid().map(p -> p.cents()).orElse(null)),
                        keyValue("bestAsk", book.getBestAsk().map(p -> p.cents()).orElse(null)),
                        keyValue("bidOrders", book.getBidOrders()),
                        keyValue("askOrders", book.getAskOrders()),
                        keyValue("bidLevels", book.getBidLevels()),
                        keyValue("askLevels", book.getAskLevels()),
                        keyValue("trades", book.getTradeCount()));
            }
        } catch (RuntimeException e) {
            // a failed tick must not cancel the schedule
            logger.error("Stats logging failed for engine {}", engineId, e);
        }
    }

    private static String ratio(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
