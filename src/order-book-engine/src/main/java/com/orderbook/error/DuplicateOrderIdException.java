package com.orderbook.error;

import com.orderbook.domain.OrderId;

public class DuplicateOrderIdException extends OrderBookException {

    private final OrderId orderId;

    public DuplicateOrderIdException(OrderId orderId) {
        super(ErrorCode.DUPLICATE_ORDER_ID, "Order id already resting: " + orderId);
        this.orderId = orderId;
    }

    public OrderId getOrderId() {
        return orderId;
    }
}
