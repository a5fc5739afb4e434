package com.nosota.lingodesk.service;

import com.nosota.lingodesk.api.model.OrderStatus;
import com.nosota.lingodesk.config.LingodeskProperties;
import com.nosota.lingodesk.error.InvalidStatusTransitionException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * State machine for validating {@link OrderStatus} transitions.
 *
 * <p>Two policies:
 * <ul>
 *   <li>permissive (default): any status may be set from any status, so operators can
 *   correct a mistaken move</li>
 *   <li>strict ({@code lingodesk.orders.strict-transitions=true}): only staying in place or
 *   moving to the next pipeline status is allowed</li>
 * </ul>
 *
 * <p>Pipeline:
 * <pre>
 * pending → translation-in-progress → lqa-in-progress
 *         → human-reviewer-assigned → human-review-in-progress → complete
 * </pre>
 */
@Component
public class OrderStatusStateMachine {

    private final boolean strict;

    @Autowired
    public OrderStatusStateMachine(LingodeskProperties properties) {
        this(properties.getOrders().isStrictTransitions());
    }

    OrderStatusStateMachine(boolean strict) {
        this.strict = strict;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * @param fromStatus current status
     * @param toStatus   requested status
     * @return true if the move is accepted under the active policy
     */
    public boolean isTransitionAllowed(OrderStatus fromStatus, OrderStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }
        if (fromStatus == toStatus || !strict) {
            return true;
        }
        return fromStatus.next() == toStatus;
    }

    /**
     * @throws InvalidStatusTransitionException if the move is not accepted
     */
    public void validateTransition(OrderStatus fromStatus, OrderStatus toStatus) {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new InvalidStatusTransitionException(fromStatus, toStatus);
        }
    }

    public Set<OrderStatus> getAllowedTransitions(OrderStatus fromStatus) {
        if (!strict) {
            return EnumSet.allOf(OrderStatus.class);
        }
        Set<OrderStatus> allowed = EnumSet.of(fromStatus);
        if (fromStatus.next() != null) {
            allowed.add(fromStatus.next());
        }
        return allowed;
    }
}
