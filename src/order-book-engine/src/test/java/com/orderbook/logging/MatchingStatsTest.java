package com.orderbook.logging;

import com.orderbook.domain.BookSnapshot;
import com.orderbook.domain.Side;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class MatchingStatsTest {

    @Test
    void countsReceivedBySide() {
        MatchingStats stats = new MatchingStats();
        stats.recordReceived(Side.BUY);
        stats.recordReceived(Side.BUY);
        stats.recordReceived(Side.SELL);
        stats.recordReceived(null);

        assertEquals(2, stats.buyOrdersReceived.get());
        assertEquals(1, stats.sellOrdersReceived.get());
        assertEquals(3, stats.totalOrdersReceived());
    }

    @Test
    void intervalCountsAreDifferences() {
        MatchingStats stats = new MatchingStats();
        stats.recordReceived(Side.BUY);
        stats.tradesExecuted.addAndGet(2);
        MatchingStats.Counts first = stats.counts();

        stats.recordReceived(Side.SELL);
        stats.recordReceived(Side.SELL);
        stats.tradesExecuted.addAndGet(1);
        stats.quantityTraded.addAndGet(10);
        stats.ordersCancelled.incrementAndGet();
        MatchingStats.Counts window = stats.counts().minus(first);

        assertEquals(0, window.buyOrders());
        assertEquals(2, window.sellOrders());
        assertEquals(2, window.orders());
        assertEquals(1, window.trades());
        assertEquals(10, window.quantity());
        assertEquals(1, window.cancelled());
        assertEquals(0.5, window.tradesPerOrder(), 1e-9);
    }

    @Test
    void noOrdersMeansZeroRatio() {
        assertEquals(0.0, MatchingStats.Counts.ZERO.tradesPerOrder());
    }

    @Test
    void summaryReadsPublishedSnapshots() {
        AtomicInteger reads = new AtomicInteger();
        PeriodicStatsLogger statsLogger = new PeriodicStatsLogger(new MatchingStats(), () -> {
            reads.incrementAndGet();
            return List.of(BookSnapshot.empty("BTC-USD"), BookSnapshot.empty("ETH-USD"));
        }, "engine-test", 60);

        statsLogger.logSummary();
        statsLogger.logSummary();
        statsLogger.logShutdownSummary();
        statsLogger.stop();

        assertEquals(2, reads.get());
    }

    @Test
    void failingSnapshotSupplierIsContained() {
        PeriodicStatsLogger statsLogger = new PeriodicStatsLogger(new MatchingStats(), () -> {
            throw new IllegalStateException("boom");
        }, "engine-test", 60);

        assertDoesNotThrow(statsLogger::logSummary);
        statsLogger.stop();
    }
}
