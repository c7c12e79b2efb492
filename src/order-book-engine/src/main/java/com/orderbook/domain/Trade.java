package com.orderbook.domain;

/**
 * Represents a single fill between a taker (incoming) order
 * and a maker (resting) order. Immutable.
 *
 * The execution price is always the maker's limit price.
 */
public final class Trade {

    private final long tradeId;
    private final String symbol;
    private final OrderId makerOrderId;
    private final OrderId takerOrderId;
    private final Side takerSide;
    private final Price price;
    private final long quantity;
    private final long timestamp;          // epoch millis

    public Trade(long tradeId, String symbol, OrderId makerOrderId, OrderId takerOrderId,
                 Side takerSide, Price price, long quantity, long timestamp) {
        this.tradeId = tradeId;
        this.symbol = symbol;
        this.makerOrderId = makerOrderId;
        this.takerOrderId = takerOrderId;
        this.takerSide = takerSide;
        this.price = price;
        this.quantity = quantity;
        this.timestamp = timestamp;
    }

    public long getTradeId() {
        return tradeId;
    }

    public String getSymbol() {
        return symbol;
    }

    public OrderId getMakerOrderId() {
        return makerOrderId;
    }

    public OrderId getTakerOrderId() {
        return takerOrderId;
    }

    public Side getTakerSide() {
        return takerSide;
    }

    public OrderId getBuyOrderId() {
        return takerSide == Side.BUY ? takerOrderId : makerOrderId;
    }

    public OrderId getSellOrderId() {
        return takerSide == Side.SELL ? takerOrderId : makerOrderId;
    }

    public Price getPrice() {
        return price;
    }

    public long getQuantity() {
        return quantity;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "Trade{" +
                "tradeId=" + tradeId +
                ", symbol='" + symbol + '\'' +
                ", maker=" + makerOrderId +
                ", taker=" + takerOrderId +
                ", takerSide=" + takerSide +
                ", price=" + price +
                ", quantity=" + quantity +
                '}';
    }
}
