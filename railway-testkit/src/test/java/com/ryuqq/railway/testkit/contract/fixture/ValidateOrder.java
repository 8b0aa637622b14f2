package com.ryuqq.railway.testkit.contract.fixture;

import com.ryuqq.railway.core.step.Step;

/**
 * Rejects orders whose quantity is not positive.
 */
public class ValidateOrder implements Step<Order, ValidatedOrder> {

    private final InvocationCounter counter;

    public ValidateOrder(InvocationCounter counter) {
        this.counter = counter;
    }

    @Override
    public ValidatedOrder run(Order input) {
        counter.record(name());
        if (input.quantity() <= 0) {
            throw new IllegalArgumentException("Quantity must be positive (current: " + input.quantity() + ")");
        }
        return new ValidatedOrder(input.orderId(), input.quantity());
    }
}
