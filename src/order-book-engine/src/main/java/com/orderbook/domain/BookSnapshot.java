package com.orderbook.domain;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Immutable top-of-book view, published by the sequencer after each command
 * so readers on other threads never see a book mid-mutation.
 */
public final class BookSnapshot {

    private final String symbol;
    private final Price bestBid;
    private final Price bestAsk;
    private final int bidOrders;
    private final int askOrders;
    private final int bidLevels;
    private final int askLevels;
    private final int tradeCount;
    private final long sequence;

    public BookSnapshot(String symbol, Price bestBid, Price bestAsk,
                        int bidOrders, int askOrders, int bidLevels, int askLevels,
                        int tradeCount, long sequence) {
        this.symbol = symbol;
        this.bestBid = bestBid;
        this.bestAsk = bestAsk;
        this.bidOrders = bidOrders;
        this.askOrders = askOrders;
        this.bidLevels = bidLevels;
        this.askLevels = askLevels;
        this.tradeCount = tradeCount;
        this.sequence = sequence;
    }

    public static BookSnapshot empty(String symbol) {
        return new BookSnapshot(symbol, null, null, 0, 0, 0, 0, 0, -1L);
    }

    public String getSymbol() {
        return symbol;
    }

    public Optional<Price> getBestBid() {
        return Optional.ofNullable(bestBid);
    }

    public Optional<Price> getBestAsk() {
        return Optional.ofNullable(bestAsk);
    }

    public OptionalLong getSpread() {
        if (bestBid == null || bestAsk == null) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(bestAsk.cents() - bestBid.cents());
    }

    public int getBidOrders() {
        return bidOrders;
    }

    public int getAskOrders() {
        return askOrders;
    }

    public int getBidLevels() {
        return bidLevels;
    }

    public int getAskLevels() {
        return askLevels;
    }

    public int getTradeCount() {
        return tradeCount;
    }

    /**
     * Ring-buffer sequence of the last command reflected here, -1 before the first.
     */
    public long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return "BookSnapshot{" +
                "symbol='" + symbol + '\'' +
                ", bestBid=" + bestBid +
                ", bestAsk=" + bestAsk +
                ", bidOrders=" + bidOrders +
                ", askOrders=" + askOrders +
                ", sequence=" + sequence +
                '}';
    }
}
