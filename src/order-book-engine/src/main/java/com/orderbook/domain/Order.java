package com.orderbook.domain;

/**
 * Limit order with fill tracking. Mutable: remainingQuantity, filledQuantity,
 * and status change as the order is matched or cancelled.
 *
 * Resting orders double as nodes of their price level's FIFO list
 * (see {@link PriceLevel}), which is what makes cancel-by-id O(1) once the
 * level is located.
 */
public class Order {

    private final OrderId id;
    private final String symbol;
    private final Side side;
    private final Price limitPrice;
    private final long originalQuantity;
    private long remainingQuantity;
    private long filledQuantity;
    private final long timestamp;
    private long sequence;
    private OrderStatus status;

    // Intrusive FIFO links, owned by PriceLevel
    Order prev;
    Order next;

    public Order(OrderId id, String symbol, Side side,
                 Price limitPrice, long quantity, long timestamp) {
        this.id = id;
        this.symbol = symbol;
        this.side = side;
        this.limitPrice = limitPrice;
        this.originalQuantity = quantity;
        this.remainingQuantity = quantity;
        this.filledQuantity = 0;
        this.timestamp = timestamp;
        this.status = OrderStatus.NEW;
    }

    /**
     * Fill this order by the given quantity. Reduces remainingQuantity,
     * increases filledQuantity, and updates status accordingly.
     */
    public void fill(long qty) {
        if (qty <= 0) {
            throw new IllegalArgumentException("Fill quantity must be positive: " + qty);
        }
        if (qty > remainingQuantity) {
            throw new IllegalArgumentException(
                "Fill quantity " + qty + " exceeds remaining " + remainingQuantity);
        }
        remainingQuantity -= qty;
        filledQuantity += qty;
        if (remainingQuantity == 0) {
            status = OrderStatus.FILLED;
        } else {
            status = OrderStatus.PARTIALLY_FILLED;
        }
    }

    void cancel() {
        status = OrderStatus.CANCELLED;
    }

    /**
     * Stamped once by the book when the order is accepted. Later orders at the
     * same price always carry a larger sequence.
     */
    void assignSequence(long sequence) {
        if (this.sequence != 0) {
            throw new IllegalStateException("Sequence already assigned to order " + id);
        }
        this.sequence = sequence;
    }

    public boolean isFilled() {
        return remainingQuantity == 0;
    }

    /**
     * Whether an incoming order at this limit can trade against a resting
     * order priced at {@code restingPrice}.
     */
    public boolean crosses(Price restingPrice) {
        if (side == Side.BUY) {
            return limitPrice.cents() >= restingPrice.cents();
        }
        return limitPrice.cents() <= restingPrice.cents();
    }

    public OrderId getId() {
        return id;
    }

    public String getSymbol() {
        return symbol;
    }

    public Side getSide() {
        return side;
    }

    public Price getLimitPrice() {
        return limitPrice;
    }

    public long getOriginalQuantity() {
        return originalQuantity;
    }

    public long getRemainingQuantity() {
        return remainingQuantity;
    }

    public long getFilledQuantity() {
        return filledQuantity;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public long getSequence() {
        return sequence;
    }

    public OrderStatus getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return "Order{" +
                "id=" + id +
                ", symbol='" + symbol + '\'' +
                ", side=" + side +
                ", price=" + limitPrice +
                ", remaining=" + remainingQuantity +
                "/" + originalQuantity +
                ", status=" + status +
                ", sequence=" + sequence +
                '}';
    }
}
