package com.pensionai.orchestration.model;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Cooperative stop conditions checked by the orchestrator between turns.
 */
public record RunControl(@Nullable Instant deadline, BooleanSupplier cancellation) {

    public RunControl {
        cancellation = cancellation == null ? () -> false : cancellation;
    }

    public static RunControl unbounded() {
        return new RunControl(null, () -> false);
    }

    public static RunControl withTimeout(@Nullable Duration timeout, BooleanSupplier cancellation) {
        Instant deadline = timeout == null || timeout.isZero() || timeout.isNegative()
                ? null
                : Instant.now().plus(timeout);
        return new RunControl(deadline, cancellation);
    }

    public Optional<Termination> interruption() {
        if (cancellation.getAsBoolean()) {
            return Optional.of(Termination.CANCELLED);
        }
        if (deadline != null && Instant.now().isAfter(deadline)) {
            return Optional.of(Termination.TIMEOUT);
        }
        return Optional.empty();
    }
}
