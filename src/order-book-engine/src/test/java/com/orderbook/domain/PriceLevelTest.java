package com.orderbook.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PriceLevelTest {

    private static final Price PRICE = new Price(100);

    private static Order order(String id, long quantity) {
        return new Order(new OrderId(id), "BTC-USD", Side.SELL, PRICE, quantity, 0L);
    }

    @Test
    void keepsArrivalOrderAndAggregates() {
        PriceLevel level = new PriceLevel(PRICE);
        Order a = order("a", 10);
        Order b = order("b", 20);
        level.addOrder(a);
        level.addOrder(b);

        assertSame(a, level.peekFirst());
        assertEquals(2, level.getOrderCount());
        assertEquals(30, level.getTotalQuantity());
        assertEquals(new BookLevel(PRICE, 30, 2), level.toBookLevel());
    }

    @Test
    void partialFillKeepsHeadAndReducesTotal() {
        PriceLevel level = new PriceLevel(PRICE);
        Order a = order("a", 10);
        level.addOrder(a);
        level.addOrder(order("b", 20));

        assertNull(level.fillFirst(4));

        assertSame(a, level.peekFirst());
        assertEquals(6, a.getRemainingQuantity());
        assertEquals(26, level.getTotalQuantity());
        assertEquals(2, level.getOrderCount());
    }

    @Test
    void fullFillUnlinksHeadAndAdvances() {
        PriceLevel level = new PriceLevel(PRICE);
        Order a = order("a", 10);
        Order b = order("b", 20);
        level.addOrder(a);
        level.addOrder(b);

        assertSame(a, level.fillFirst(10));

        assertSame(b, level.peekFirst());
        assertEquals(1, level.getOrderCount());
        assertEquals(20, level.getTotalQuantity());
    }

    @Test
    void removeFromHeadMiddleAndTail() {
        PriceLevel level = new PriceLevel(PRICE);
        Order a = order("a", 1);
        Order b = order("b", 2);
        Order c = order("c", 3);
        Order d = order("d", 4);
        level.addOrder(a);
        level.addOrder(b);
        level.addOrder(c);
        level.addOrder(d);

        level.removeOrder(b);
        assertEquals(3, level.getOrderCount());
        assertEquals(8, level.getTotalQuantity());

        level.removeOrder(a);
        assertSame(c, level.peekFirst());

        level.removeOrder(d);
        assertSame(c, level.peekFirst());
        assertEquals(3, level.getTotalQuantity());

        // appending after tail removal links behind the remaining order
        Order e = order("e", 5);
        level.addOrder(e);
        assertSame(c, level.fillFirst(3));
        assertSame(e, level.peekFirst());

        level.removeOrder(e);
        assertTrue(level.isEmpty());
        assertEquals(0, level.getOrderCount());
        assertEquals(0, level.getTotalQuantity());
    }

    @Test
    void fillOnEmptyLevelIsAnError() {
        PriceLevel level = new PriceLevel(PRICE);

        assertThrows(IllegalStateException.class, () -> level.fillFirst(1));
    }

    @Test
    void overflowingTotalLeavesLevelUnchanged() {
        PriceLevel level = new PriceLevel(PRICE);
        Order big = order("big", Long.MAX_VALUE - 1);
        level.addOrder(big);

        assertThrows(ArithmeticException.class, () -> level.addOrder(order("more", 2)));
        assertEquals(1, level.getOrderCount());
        assertEquals(Long.MAX_VALUE - 1, level.getTotalQuantity());
        assertSame(big, level.peekFirst());
    }
}
