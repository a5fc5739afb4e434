package com.nosota.lingodesk.error;

import com.nosota.lingodesk.api.model.OrderStatus;

public class InvalidStatusTransitionException extends IllegalStateException {
    public InvalidStatusTransitionException(OrderStatus from, OrderStatus to) {
        super(String.format("Invalid order status transition: %s -> %s", from.getValue(), to.getValue()));
    }
}
