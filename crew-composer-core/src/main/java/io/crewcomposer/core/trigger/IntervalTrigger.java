package io.crewcomposer.core.trigger;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

public record IntervalTrigger(Duration interval) implements Trigger {
    public IntervalTrigger {
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    @Override
    public Optional<Instant> nextFireTime(Instant previousFireTime, Instant now) {
        if (previousFireTime == null) {
            return Optional.of(now.plus(interval));
        }
        Instant next = previousFireTime.plus(interval);
        if (next.isAfter(now)) {
            return Optional.of(next);
        }
        long missed = Duration.between(previousFireTime, now).toMillis() / interval.toMillis();
        return Optional.of(previousFireTime.plus(interval.multipliedBy(missed + 1)));
    }
}
