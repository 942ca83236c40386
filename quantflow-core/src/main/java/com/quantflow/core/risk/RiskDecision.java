package com.quantflow.core.risk;

import com.quantflow.core.model.OrderIntent;
import com.quantflow.core.model.Signal;

import java.util.Optional;

/**
 * Outcome of gating one signal. A veto is a normal outcome, not an error.
 */
public sealed interface RiskDecision {

    Signal signal();

    default Optional<OrderIntent> intent() {
        return Optional.empty();
    }

    default boolean isApproved() {
        return false;
    }

    /** The signal became an order intent. */
    record Approved(Signal signal, OrderIntent orderIntent) implements RiskDecision {
        @Override
        public Optional<OrderIntent> intent() {
            return Optional.of(orderIntent);
        }

        @Override
        public boolean isApproved() {
            return true;
        }
    }

    /** A risk limit blocked the signal. */
    record Vetoed(Signal signal, VetoReason reason, String detail) implements RiskDecision {
    }

    /** Nothing to do: a hold, or a sell with nothing held. */
    record NoAction(Signal signal, String detail) implements RiskDecision {
    }
}
