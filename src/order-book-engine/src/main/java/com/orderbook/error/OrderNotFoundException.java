package com.orderbook.error;

import com.orderbook.domain.OrderId;

/**
 * Cancel target is not resting: it was fully filled, already cancelled,
 * or never existed.
 */
public class OrderNotFoundException extends OrderBookException {

    private final OrderId orderId;

    public OrderNotFoundException(OrderId orderId) {
        super(ErrorCode.ORDER_NOT_FOUND, "Order not resting: " + orderId);
        this.orderId = orderId;
    }

    public OrderId getOrderId() {
        return orderId;
    }
}
