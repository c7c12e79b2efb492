package com.orderbook.domain;

import com.orderbook.error.DuplicateOrderIdException;
import com.orderbook.error.InvalidOrderException;
import com.orderbook.error.OrderNotFoundException;
import com.orderbook.matching.MatchingAlgorithm;
import com.orderbook.matching.PriceTimePriorityMatcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * In-memory order book for a single symbol.
 *
 * Bids: TreeMap with Comparator.reverseOrder() so firstKey() = highest bid.
 * Asks: TreeMap with natural ordering so firstKey() = lowest ask.
 * Order index: HashMap for O(1) lookup by orderId (used for cancels).
 *
 * Not thread-safe. Every mutating call must come from one thread at a time;
 * {@link com.orderbook.disruptor.OrderSequencer} provides that discipline.
 */
public class OrderBook {

    private final String symbol;
    private final TreeMap<Price, PriceLevel> bids;
    private final TreeMap<Price, PriceLevel> asks;
    private final HashMap<OrderId, Order> orderIndex;
    private final MatchingAlgorithm matcher;
    private final List<Trade> trades;
    private long lastSequence;
    private int bidOrderCount;
    private int askOrderCount;

    public OrderBook(String symbol) {
        this(symbol, new PriceTimePriorityMatcher());
    }

    public OrderBook(String symbol, MatchingAlgorithm matcher) {
        this.symbol = symbol;
        this.matcher = matcher;
        this.bids = new TreeMap<>(Comparator.reverseOrder());
        this.asks = new TreeMap<>();
        this.orderIndex = new HashMap<>();
        this.trades = new ArrayList<>();
    }

    /**
     * Match an incoming order against the opposite side and rest any
     * unfilled remainder on its own side.
     *
     * Validation happens before anything is touched, so a rejected order
     * leaves the book unchanged.
     *
     * @return the trades produced, in the order they executed; empty if none
     * @throws InvalidOrderException if a field is missing, the symbol does not
     *         match this book, price or quantity is not positive, or resting the
     *         quantity would overflow its level total
     * @throws DuplicateOrderIdException if an order with the same id is resting
     */
    public List<Trade> addOrder(Order order) {
        validate(order);
        order.assignSequence(++lastSequence);

        MatchResultSet result = matcher.match(this, order);
        if (!result.incomingFullyFilled()) {
            rest(order);
        }
        trades.addAll(result.trades());
        return result.trades();
    }

    /**
     * Remove a resting order by id. Looks up in the index, unlinks it from
     * its price level, and cleans up the level if it became empty.
     *
     * @return the cancelled order, carrying the quantity that was still open
     * @throws OrderNotFoundException if no order with this id is resting
     */
    public Order cancelOrder(OrderId orderId) {
        Order order = orderIndex.remove(orderId);
        if (order == null) {
            throw new OrderNotFoundException(orderId);
        }
        TreeMap<Price, PriceLevel> side = sideOf(order.getSide());
        PriceLevel level = side.get(order.getLimitPrice());
        if (level == null) {
            throw new IllegalStateException("Indexed order " + orderId + " has no price level");
        }
        level.removeOrder(order);
        if (level.isEmpty()) {
            side.remove(order.getLimitPrice());
        }
        decrementCount(order.getSide());
        order.cancel();
        return order;
    }

    /**
     * Best level on the given side, or {@code null} when that side is empty.
     */
    public PriceLevel getBestLevel(Side side) {
        Map.Entry<Price, PriceLevel> entry = sideOf(side).firstEntry();
        return entry != null ? entry.getValue() : null;
    }

    /**
     * Drop a maker that the matcher has just filled to zero. The level has
     * already unlinked it; this removes it from the index and removes the
     * level if nothing is left there.
     */
    public void removeFilledOrder(Order order) {
        if (!order.isFilled()) {
            throw new IllegalStateException("Order " + order.getId() + " is not filled");
        }
        orderIndex.remove(order.getId());
        TreeMap<Price, PriceLevel> side = sideOf(order.getSide());
        PriceLevel level = side.get(order.getLimitPrice());
        if (level != null && level.isEmpty()) {
            side.remove(order.getLimitPrice());
        }
        decrementCount(order.getSide());
    }

    private void rest(Order order) {
        PriceLevel level = sideOf(order.getSide())
                .computeIfAbsent(order.getLimitPrice(), PriceLevel::new);
        level.addOrder(order);
        orderIndex.put(order.getId(), order);
        if (order.getSide() == Side.BUY) {
            bidOrderCount++;
        } else {
            askOrderCount++;
        }
    }

    private void validate(Order order) {
        if (order == null) {
            throw new InvalidOrderException("Order must not be null");
        }
        if (order.getId() == null || order.getId().value() == null
                || order.getId().value().isBlank()) {
            throw new InvalidOrderException("Order id must not be blank");
        }
        if (order.getSide() == null) {
            throw new InvalidOrderException("Side is required for order " + order.getId());
        }
        if (order.getLimitPrice() == null) {
            throw new InvalidOrderException("Price is required for order " + order.getId());
        }
        if (!symbol.equals(order.getSymbol())) {
            throw new InvalidOrderException("Order " + order.getId() + " is for symbol "
                    + order.getSymbol() + ", book is " + symbol);
        }
        if (!order.getLimitPrice().isPositive()) {
            throw new InvalidOrderException("Price must be positive: " + order.getLimitPrice());
        }
        if (order.getRemainingQuantity() <= 0) {
            throw new InvalidOrderException(
                    "Quantity must be positive: " + order.getRemainingQuantity());
        }
        if (order.getSequence() != 0 || order.getStatus() != OrderStatus.NEW) {
            throw new InvalidOrderException("Order " + order.getId() + " was already submitted");
        }
        if (orderIndex.containsKey(order.getId())) {
            throw new DuplicateOrderIdException(order.getId());
        }
        // the remainder can never exceed the full quantity, so this keeps the level total exact
        PriceLevel level = sideOf(order.getSide()).get(order.getLimitPrice());
        if (level != null && level.getTotalQuantity() > Long.MAX_VALUE - order.getRemainingQuantity()) {
            throw new InvalidOrderException("Quantity " + order.getRemainingQuantity()
                    + " would overflow the resting total at " + order.getLimitPrice());
        }
    }

    private TreeMap<Price, PriceLevel> sideOf(Side side) {
        return side == Side.BUY ? bids : asks;
    }

    private void decrementCount(Side side) {
        if (side == Side.BUY) {
            bidOrderCount--;
        } else {
            askOrderCount--;
        }
    }

    public Optional<Price> bestBid() {
        return bids.isEmpty() ? Optional.empty() : Optional.of(bids.firstKey());
    }

    public Optional<Price> bestAsk() {
        return asks.isEmpty() ? Optional.empty() : Optional.of(asks.firstKey());
    }

    /**
     * Best ask minus best bid in cents, present only when both sides have orders.
     */
    public OptionalLong spread() {
        if (bids.isEmpty() || asks.isEmpty()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(asks.firstKey().cents() - bids.firstKey().cents());
    }

    public Optional<Order> getOrder(OrderId orderId) {
        return Optional.ofNullable(orderIndex.get(orderId));
    }

    /**
     * Total resting quantity at the given bid price, 0 if there is no such level.
     */
    public long bidDepthAt(Price price) {
        PriceLevel level = bids.get(price);
        return level != null ? level.getTotalQuantity() : 0;
    }

    public long askDepthAt(Price price) {
        PriceLevel level = asks.get(price);
        return level != null ? level.getTotalQuantity() : 0;
    }

    /**
     * Bid levels from best (highest) to worst.
     */
    public List<BookLevel> bidSnapshot() {
        return bidSnapshot(Integer.MAX_VALUE);
    }

    public List<BookLevel> bidSnapshot(int depth) {
        return snapshotOf(bids, depth);
    }

    /**
     * Ask levels from best (lowest) to worst.
     */
    public List<BookLevel> askSnapshot() {
        return askSnapshot(Integer.MAX_VALUE);
    }

    public List<BookLevel> askSnapshot(int depth) {
        return snapshotOf(asks, depth);
    }

    private static List<BookLevel> snapshotOf(TreeMap<Price, PriceLevel> side, int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("Depth must not be negative: " + depth);
        }
        List<BookLevel> levels = new ArrayList<>(Math.min(depth, side.size()));
        for (PriceLevel level : side.values()) {
            if (levels.size() >= depth) {
                break;
            }
            levels.add(level.toBookLevel());
        }
        return levels;
    }

    /**
     * Immutable view of the book's top and size, tagged with the sequence of
     * the last command applied to it.
     */
    public BookSnapshot snapshot(long sequence) {
        return new BookSnapshot(symbol,
                bids.isEmpty() ? null : bids.firstKey(),
                asks.isEmpty() ? null : asks.firstKey(),
                bidOrderCount, askOrderCount,
                bids.size(), asks.size(),
                trades.size(), sequence);
    }

    /**
     * Every trade this book has produced, oldest first.
     */
    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }

    /**
     * Total number of resting orders on the bid side across all price levels.
     */
    public int getBidDepth() {
        return bidOrderCount;
    }

    /**
     * Total number of resting orders on the ask side across all price levels.
     */
    public int getAskDepth() {
        return askOrderCount;
    }

    public int getBidLevelCount() {
        return bids.size();
    }

    public int getAskLevelCount() {
        return asks.size();
    }

    public String getSymbol() {
        return symbol;
    }
}
