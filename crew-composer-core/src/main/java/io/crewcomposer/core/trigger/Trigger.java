package io.crewcomposer.core.trigger;

import java.time.Instant;
import java.util.Optional;

public interface Trigger {

    /**
     * Next fire time strictly after both {@code previousFireTime} and {@code now}, which
     * collapses any fire times missed in between. {@code previousFireTime} is null before the
     * first firing. Empty when the trigger will never fire again.
     */
    Optional<Instant> nextFireTime(Instant previousFireTime, Instant now);
}
