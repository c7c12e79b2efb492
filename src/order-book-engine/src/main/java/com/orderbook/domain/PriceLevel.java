package com.orderbook.domain;

/**
 * FIFO queue of orders at a single price point.
 * Orders are matched in time priority (first-in, first-out).
 *
 * The queue is an intrusive doubly-linked list threaded through the orders
 * themselves: append, head removal and removal of an arbitrary order
 * (cancel) are all O(1).
 */
public class PriceLevel {

    private final Price price;
    private Order head;
    private Order tail;
    private int orderCount;
    private long totalQuantity;

    public PriceLevel(Price price) {
        this.price = price;
    }

    /**
     * @throws ArithmeticException if the level total would overflow; the
     *         level is left unchanged
     */
    public void addOrder(Order order) {
        long newTotal = Math.addExact(totalQuantity, order.getRemainingQuantity());
        order.prev = tail;
        order.next = null;
        if (tail == null) {
            head = order;
        } else {
            tail.next = order;
        }
        tail = order;
        orderCount++;
        totalQuantity = newTotal;
    }

    public Order peekFirst() {
        return head;
    }

    /**
     * Fill the oldest order at this level by {@code qty}, keeping the level's
     * aggregate quantity in step. A head order that reaches zero is unlinked
     * and returned so the caller can retire it from the book index.
     *
     * @return the head order if it is now fully filled, otherwise {@code null}
     */
    public Order fillFirst(long qty) {
        Order first = head;
        if (first == null) {
            throw new IllegalStateException("Fill on empty price level " + price);
        }
        first.fill(qty);
        totalQuantity -= qty;
        if (first.isFilled()) {
            unlink(first);
            return first;
        }
        return null;
    }

    /**
     * Remove a specific order by reference. Used for cancel operations.
     * The order must currently be queued at this level.
     */
    public void removeOrder(Order order) {
        totalQuantity -= order.getRemainingQuantity();
        unlink(order);
    }

    private void unlink(Order order) {
        if (order.prev != null) {
            order.prev.next = order.next;
        } else {
            head = order.next;
        }
        if (order.next != null) {
            order.next.prev = order.prev;
        } else {
            tail = order.prev;
        }
        order.prev = null;
        order.next = null;
        orderCount--;
    }

    public boolean isEmpty() {
        return head == null;
    }

    public long getTotalQuantity() {
        return totalQuantity;
    }

    public int getOrderCount() {
        return orderCount;
    }

    public Price getPrice() {
        return price;
    }

    public BookLevel toBookLevel() {
        return new BookLevel(price, totalQuantity, orderCount);
    }
}
