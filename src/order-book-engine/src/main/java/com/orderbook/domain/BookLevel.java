package com.orderbook.domain;

/**
 * Aggregated view of one price level, as returned by depth snapshots.
 */
public record BookLevel(Price price, long totalQuantity, int orderCount) {
}
