package com.orderbook.matching;

import com.orderbook.domain.MatchResultSet;
import com.orderbook.domain.Order;
import com.orderbook.domain.OrderBook;
import com.orderbook.domain.PriceLevel;
import com.orderbook.domain.Side;
import com.orderbook.domain.Trade;

import java.util.ArrayList;
import java.util.List;

/**
 * Price-time priority matching algorithm.
 *
 * Price priority: best price on the opposite side is matched first
 * (lowest ask for a buy, highest bid for a sell).
 *
 * Time priority: within the same price level, the order that arrived
 * earliest is matched first (FIFO via the level's linked queue).
 *
 * Every fill produces its own trade at the maker's price, even when
 * consecutive fills share a price.
 *
 * Time complexity: O(log P + F) where P = price levels, F = fills.
 *
 * Trade ids come from a counter owned by this instance, so use one
 * matcher per book.
 */
public class PriceTimePriorityMatcher implements MatchingAlgorithm {

    private long tradeSequence;

    @Override
    public MatchResultSet match(OrderBook book, Order incoming) {
        List<Trade> trades = new ArrayList<>();
        Side makerSide = incoming.getSide().opposite();

        while (incoming.getRemainingQuantity() > 0) {
            PriceLevel level = book.getBestLevel(makerSide);
            if (level == null || !incoming.crosses(level.getPrice())) {
                break;
            }

            Order maker = level.peekFirst();
            long fillQty = Math.min(incoming.getRemainingQuantity(),
                                    maker.getRemainingQuantity());

            incoming.fill(fillQty);
            Order exhausted = level.fillFirst(fillQty);

            trades.add(new Trade(
                    ++tradeSequence,
                    book.getSymbol(),
                    maker.getId(),
                    incoming.getId(),
                    incoming.getSide(),
                    maker.getLimitPrice(),
                    fillQty,
                    System.currentTimeMillis()
            ));

            if (exhausted != null) {
                book.removeFilledOrder(exhausted);
            }
        }

        return new MatchResultSet(trades, incoming.isFilled());
    }
}
