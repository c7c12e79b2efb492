package com.orderbook.disruptor;

public enum CommandType {
    ADD,
    CANCEL,
    QUERY
}
