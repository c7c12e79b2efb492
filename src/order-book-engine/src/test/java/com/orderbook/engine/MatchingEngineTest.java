package com.orderbook.engine;

import com.orderbook.config.EngineConfig;
import com.orderbook.domain.BookLevel;
import com.orderbook.domain.BookSnapshot;
import com.orderbook.domain.Order;
import com.orderbook.domain.OrderId;
import com.orderbook.domain.OrderStatus;
import com.orderbook.domain.Price;
import com.orderbook.domain.Side;
import com.orderbook.domain.Trade;
import com.orderbook.error.DuplicateOrderIdException;
import com.orderbook.error.ErrorCode;
import com.orderbook.error.InvalidOrderException;
import com.orderbook.error.OrderNotFoundException;
import com.orderbook.error.UnknownSymbolException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MatchingEngineTest {

    private static final String BTC = "BTC-USD";
    private static final String ETH = "ETH-USD";

    private MatchingEngine engine;

    @BeforeEach
    void setUp() {
        engine = new MatchingEngine(EngineConfig.fromMap(Map.of(
                "ENGINE_ID", "engine-test",
                "SYMBOLS", BTC + "," + ETH,
                "RING_BUFFER_SIZE", "256",
                "STATS_INTERVAL_SECONDS", "0")));
        engine.start();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static Order order(String symbol, String id, Side side, long price, long quantity) {
        return new Order(new OrderId(id), symbol, side, new Price(price), quantity, 0L);
    }

    @Test
    void exposesConfiguredSymbolsInOrder() {
        assertEquals(List.of(BTC, ETH), List.copyOf(engine.symbols()));
        assertEquals(Set.of(BTC, ETH), engine.symbols());
    }

    @Test
    void matchesIncomingOrderAgainstRestingLiquidity() {
        engine.addOrder(order(BTC, "s1", Side.SELL, 100, 10));
        engine.addOrder(order(BTC, "s2", Side.SELL, 99, 5));

        List<Trade> trades = engine.addOrder(order(BTC, "b1", Side.BUY, 100, 12));

        assertEquals(2, trades.size());
        assertEquals(new OrderId("s2"), trades.get(0).getMakerOrderId());
        assertEquals(new Price(99), trades.get(0).getPrice());
        assertEquals(5, trades.get(0).getQuantity());
        assertEquals(new OrderId("s1"), trades.get(1).getMakerOrderId());
        assertEquals(new Price(100), trades.get(1).getPrice());
        assertEquals(7, trades.get(1).getQuantity());

        assertEquals(Optional.empty(), engine.bestBid(BTC));
        assertEquals(Optional.of(new Price(100)), engine.bestAsk(BTC));
        assertEquals(List.of(new BookLevel(new Price(100), 3, 1)), engine.askLevels(BTC, 10));
    }

    @Test
    void symbolsAreIsolated() {
        engine.addOrder(order(BTC, "x1", Side.SELL, 100, 5));
        List<Trade> trades = engine.addOrder(order(ETH, "x2", Side.BUY, 100, 5));

        assertTrue(trades.isEmpty());
        assertEquals(Optional.of(new Price(100)), engine.bestAsk(BTC));
        assertEquals(Optional.of(new Price(100)), engine.bestBid(ETH));
        assertEquals(Optional.empty(), engine.bestBid(BTC));
        assertEquals(Optional.empty(), engine.bestAsk(ETH));

        // same id may rest in two different books
        assertDoesNotThrow(() -> engine.addOrder(order(ETH, "x1", Side.BUY, 90, 1)));
    }

    @Test
    void blockingAddRethrowsEngineErrors() {
        engine.addOrder(order(BTC, "b1", Side.BUY, 99, 1));

        DuplicateOrderIdException duplicate = assertThrows(DuplicateOrderIdException.class,
                () -> engine.addOrder(order(BTC, "b1", Side.BUY, 98, 1)));
        assertEquals(ErrorCode.DUPLICATE_ORDER_ID, duplicate.getCode());

        assertThrows(InvalidOrderException.class,
                () -> engine.addOrder(order(BTC, "b2", Side.BUY, 99, -1)));
        assertThrows(InvalidOrderException.class, () -> engine.addOrder(null));
        // null never reaches a sequencer
        assertEquals(2, engine.getStats().ordersRejected.get());
    }

    @Test
    void rejectionLeavesBookUnchanged() {
        engine.addOrder(order(BTC, "b1", Side.BUY, 99, 4));

        assertThrows(InvalidOrderException.class,
                () -> engine.addOrder(order(BTC, "b2", Side.BUY, 0, 4)));

        assertEquals(List.of(new BookLevel(new Price(99), 4, 1)), engine.bidLevels(BTC, 10));
        assertTrue(engine.trades(BTC).isEmpty());
        assertEquals(1, engine.getStats().ordersRejected.get());
    }

    @Test
    void unknownSymbolIsRejected() {
        UnknownSymbolException e = assertThrows(UnknownSymbolException.class,
                () -> engine.addOrder(order("DOGE-USD", "d1", Side.BUY, 1, 1)));
        assertEquals(ErrorCode.UNKNOWN_SYMBOL, e.getCode());
        assertEquals("DOGE-USD", e.getSymbol());

        assertThrows(UnknownSymbolException.class, () -> engine.bestBid("DOGE-USD"));
        assertThrows(UnknownSymbolException.class, () -> engine.snapshot("DOGE-USD"));
        assertThrows(UnknownSymbolException.class,
                () -> engine.cancelOrder("DOGE-USD", new OrderId("d1")));
    }

    @Test
    void asyncSubmitFailsFutureForUnknownSymbol() {
        CompletableFuture<List<Trade>> future = engine.submit(order("DOGE-USD", "d1", Side.BUY, 1, 1));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(UnknownSymbolException.class, e.getCause());
    }

    @Test
    void cancelRemovesRestingOrder() {
        engine.addOrder(order(BTC, "b1", Side.BUY, 99, 4));
        engine.addOrder(order(BTC, "b2", Side.BUY, 98, 2));

        Order cancelled = engine.cancelOrder(BTC, new OrderId("b1"));

        assertEquals(OrderStatus.CANCELLED, cancelled.getStatus());
        assertEquals(4, cancelled.getRemainingQuantity());
        assertEquals(Optional.of(new Price(98)), engine.bestBid(BTC));

        OrderNotFoundException e = assertThrows(OrderNotFoundException.class,
                () -> engine.cancelOrder(BTC, new OrderId("b1")));
        assertEquals(new OrderId("b1"), e.getOrderId());
        assertEquals(1, engine.getStats().ordersCancelled.get());
    }

    @Test
    void tradesReturnsCopyOfTradeLog() {
        engine.addOrder(order(BTC, "s1", Side.SELL, 100, 2));
        engine.addOrder(order(BTC, "b1", Side.BUY, 100, 1));
        engine.addOrder(order(BTC, "b2", Side.BUY, 100, 1));

        List<Trade> trades = engine.trades(BTC);

        assertEquals(2, trades.size());
        assertEquals(1, trades.get(0).getTradeId());
        assertEquals(2, trades.get(1).getTradeId());
        assertThrows(UnsupportedOperationException.class, () -> trades.remove(0));
        assertTrue(engine.trades(ETH).isEmpty());
    }

    @Test
    void snapshotReflectsCompletedCommands() {
        engine.addOrder(order(BTC, "b1", Side.BUY, 99, 4));
        engine.addOrder(order(BTC, "s1", Side.SELL, 101, 4));

        BookSnapshot snapshot = engine.snapshot(BTC);

        assertEquals(Optional.of(new Price(99)), snapshot.getBestBid());
        assertEquals(Optional.of(new Price(101)), snapshot.getBestAsk());
        assertEquals(2, snapshot.getSpread().getAsLong());
        assertEquals(1, snapshot.getBidLevels());
        assertEquals(1, snapshot.getAskLevels());
    }

    @Test
    void statsCountReceivedAndTraded() {
        engine.addOrder(order(BTC, "s1", Side.SELL, 100, 5));
        engine.addOrder(order(BTC, "b1", Side.BUY, 100, 3));
        engine.addOrder(order(ETH, "b2", Side.BUY, 50, 1));

        assertEquals(2, engine.getStats().buyOrdersReceived.get());
        assertEquals(1, engine.getStats().sellOrdersReceived.get());
        assertEquals(1, engine.getStats().tradesExecuted.get());
        assertEquals(3, engine.getStats().quantityTraded.get());
    }

    @Test
    void commandsBeforeStartFailInsteadOfHanging() {
        MatchingEngine idle = new MatchingEngine(EngineConfig.fromMap(Map.of(
                "SYMBOLS", BTC,
                "STATS_INTERVAL_SECONDS", "0")));
        try {
            assertThrows(RejectedExecutionException.class,
                    () -> idle.addOrder(order(BTC, "b1", Side.BUY, 100, 5)));
            assertThrows(RejectedExecutionException.class,
                    () -> idle.cancelOrder(BTC, new OrderId("b1")));
            assertThrows(RejectedExecutionException.class, () -> idle.trades(BTC));
        } finally {
            idle.close();
        }
    }

    @Test
    void commandsAfterCloseAreRejected() {
        engine.close();

        assertThrows(RejectedExecutionException.class,
                () -> engine.addOrder(order(BTC, "b1", Side.BUY, 100, 5)));
    }

    @Test
    void closeIsIdempotent() {
        engine.close();
        assertDoesNotThrow(() -> engine.close());
    }
}
