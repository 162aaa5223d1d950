package io.crewcomposer.core.trigger;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

public record DateTrigger(Instant runAt) implements Trigger {
    public DateTrigger {
        Objects.requireNonNull(runAt, "runAt must not be null");
    }

    // Fires once, even when runAt already passed; the engine applies the misfire grace period.
    @Override
    public Optional<Instant> nextFireTime(Instant previousFireTime, Instant now) {
        return previousFireTime == null ? Optional.of(runAt) : Optional.empty();
    }
}
