package io.crewcomposer.core.trigger;

import com.cronutils.model.time.ExecutionTime;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

public final class CronTrigger implements Trigger {
    private final String expression;
    private final ZoneId zone;
    private final ExecutionTime executionTime;

    CronTrigger(String expression, ZoneId zone, ExecutionTime executionTime) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.executionTime = Objects.requireNonNull(executionTime, "executionTime must not be null");
    }

    public String expression() {
        return expression;
    }

    public ZoneId zone() {
        return zone;
    }

    @Override
    public Optional<Instant> nextFireTime(Instant previousFireTime, Instant now) {
        Instant base = previousFireTime != null && previousFireTime.isAfter(now) ? previousFireTime : now;
        ZonedDateTime from = base.atZone(zone);
        return executionTime.nextExecution(from).map(ZonedDateTime::toInstant);
    }

    @Override
    public String toString() {
        return "CronTrigger[" + expression + " " + zone + "]";
    }
}
