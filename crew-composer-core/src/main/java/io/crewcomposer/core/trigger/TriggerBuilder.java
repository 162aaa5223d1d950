package io.crewcomposer.core.trigger;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import io.crewcomposer.core.schedule.ScheduleEntry;
import io.crewcomposer.core.schedule.Timestamps;
import io.crewcomposer.core.schedule.TriggerKind;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Maps the trigger fields of a {@link ScheduleEntry} to a {@link Trigger}. Stateless and free of
 * I/O, so it is safe to call on every reconciliation pass.
 *
 * <p>Cron entries use the field names {@code year, month, day, day_of_week, hour, minute,
 * second}. Omitted fields more significant than the least significant given one match
 * everything; less significant ones default to their minimum, so {@code {"hour": "3"}} fires
 * daily at 03:00:00. {@code day_of_week} never defaults to a minimum and counts from 0 (Monday)
 * to 6 (Sunday); it is rewritten to day names before the fields are rendered as a Quartz
 * expression, whose own numbering starts at 1 (Sunday).
 */
public final class TriggerBuilder {
    private static final List<String> CRON_FIELDS = List.of("year", "month", "day", "day_of_week", "hour", "minute", "second");
    private static final Map<String, String> CRON_MINIMUMS = Map.of(
        "month", "1",
        "day", "1",
        "hour", "0",
        "minute", "0",
        "second", "0"
    );
    private static final List<String> DAY_NAMES = List.of("MON", "TUE", "WED", "THU", "FRI", "SAT", "SUN");
    private static final CronParser QUARTZ_PARSER = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.QUARTZ));

    private final ZoneId defaultZone;

    public TriggerBuilder() {
        this(ZoneId.systemDefault());
    }

    public TriggerBuilder(ZoneId defaultZone) {
        this.defaultZone = Objects.requireNonNull(defaultZone, "defaultZone must not be null");
    }

    public ZoneId defaultZone() {
        return defaultZone;
    }

    public Trigger build(ScheduleEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        requireSinglePayload(entry);
        ZoneId zone = zoneOf(entry);
        return switch (entry.triggerKind()) {
            case DATE -> dateTrigger(entry, zone);
            case INTERVAL -> intervalTrigger(entry);
            case CRON -> cronTrigger(entry, zone);
        };
    }

    /**
     * Renders the cron mapping of a cron entry as the Quartz expression it will be scheduled with.
     */
    public String cronExpression(ScheduleEntry entry) {
        if (entry.cron() == null || entry.cron().isEmpty()) {
            throw new InvalidTriggerException(entry.id(), "cron trigger requires a non-empty cron field mapping");
        }
        Map<String, String> given = new LinkedHashMap<>();
        for (Map.Entry<String, String> field : entry.cron().entrySet()) {
            String name = field.getKey().trim().toLowerCase(Locale.ROOT);
            if (!CRON_FIELDS.contains(name)) {
                throw new InvalidTriggerException(
                    entry.id(),
                    "unsupported cron field '" + field.getKey() + "'; supported fields: " + String.join(", ", CRON_FIELDS)
                );
            }
            String value = field.getValue().trim();
            if (!value.isEmpty()) {
                given.put(name, value.toUpperCase(Locale.ROOT));
            }
        }
        if (given.isEmpty()) {
            throw new InvalidTriggerException(entry.id(), "cron trigger requires at least one non-empty cron field");
        }
        if (given.containsKey("day") && given.containsKey("day_of_week")) {
            throw new InvalidTriggerException(entry.id(), "cron trigger cannot restrict both day and day_of_week");
        }

        int leastSignificant = 0;
        for (int i = 0; i < CRON_FIELDS.size(); i++) {
            if (given.containsKey(CRON_FIELDS.get(i))) {
                leastSignificant = i;
            }
        }
        Map<String, String> resolved = new HashMap<>();
        for (int i = 0; i < CRON_FIELDS.size(); i++) {
            String name = CRON_FIELDS.get(i);
            if (given.containsKey(name)) {
                resolved.put(name, given.get(name));
            } else if (i < leastSignificant || "day_of_week".equals(name)) {
                resolved.put(name, "*");
            } else {
                resolved.put(name, CRON_MINIMUMS.get(name));
            }
        }
        if (given.containsKey("day_of_week")) {
            resolved.put("day_of_week", daysOfWeek(entry.id(), given.get("day_of_week")));
            resolved.put("day", "?");
        } else {
            resolved.put("day_of_week", "?");
        }

        List<String> parts = new ArrayList<>(List.of(
            resolved.get("second"),
            resolved.get("minute"),
            resolved.get("hour"),
            resolved.get("day"),
            resolved.get("month"),
            resolved.get("day_of_week")
        ));
        if (given.containsKey("year")) {
            parts.add(resolved.get("year"));
        }
        return String.join(" ", parts);
    }

    /**
     * Rewrites a day-of-week field such as {@code 1-5} or {@code mon,wed}, steps included, to
     * Quartz day names, collapsing consecutive days into ranges.
     */
    private static String daysOfWeek(String scheduleId, String value) {
        boolean[] days = new boolean[DAY_NAMES.size()];
        for (String part : value.split(",")) {
            String[] rangeAndStep = part.trim().split("/", -1);
            if (rangeAndStep.length > 2) {
                throw invalidDayOfWeek(scheduleId, value);
            }
            int step = 1;
            if (rangeAndStep.length == 2) {
                step = stepOf(scheduleId, value, rangeAndStep[1]);
            }
            String range = rangeAndStep[0].trim();
            int first;
            int last;
            if ("*".equals(range)) {
                first = 0;
                last = DAY_NAMES.size() - 1;
            } else {
                String[] bounds = range.split("-", -1);
                if (bounds.length > 2) {
                    throw invalidDayOfWeek(scheduleId, value);
                }
                first = dayIndex(scheduleId, value, bounds[0]);
                if (bounds.length == 2) {
                    last = dayIndex(scheduleId, value, bounds[1]);
                } else {
                    last = rangeAndStep.length == 2 ? DAY_NAMES.size() - 1 : first;
                }
                if (first > last) {
                    throw invalidDayOfWeek(scheduleId, value);
                }
            }
            for (int day = first; day <= last; day += step) {
                days[day] = true;
            }
        }

        List<String> runs = new ArrayList<>();
        int day = 0;
        while (day < days.length) {
            if (!days[day]) {
                day++;
                continue;
            }
            int end = day;
            while (end + 1 < days.length && days[end + 1]) {
                end++;
            }
            runs.add(end == day ? DAY_NAMES.get(day) : DAY_NAMES.get(day) + "-" + DAY_NAMES.get(end));
            day = end + 1;
        }
        if (runs.size() == 1 && runs.get(0).equals(DAY_NAMES.get(0) + "-" + DAY_NAMES.get(DAY_NAMES.size() - 1))) {
            return "*";
        }
        return String.join(",", runs);
    }

    private static int dayIndex(String scheduleId, String value, String token) {
        String day = token.trim();
        int index = DAY_NAMES.indexOf(day);
        if (index >= 0) {
            return index;
        }
        try {
            index = Integer.parseInt(day);
        } catch (NumberFormatException e) {
            throw invalidDayOfWeek(scheduleId, value);
        }
        if (index < 0 || index >= DAY_NAMES.size()) {
            throw invalidDayOfWeek(scheduleId, value);
        }
        return index;
    }

    private static int stepOf(String scheduleId, String value, String token) {
        try {
            int step = Integer.parseInt(token.trim());
            if (step > 0) {
                return step;
            }
        } catch (NumberFormatException e) {
            throw invalidDayOfWeek(scheduleId, value);
        }
        throw invalidDayOfWeek(scheduleId, value);
    }

    private static InvalidTriggerException invalidDayOfWeek(String scheduleId, String value) {
        return new InvalidTriggerException(
            scheduleId,
            "day_of_week '" + value + "' must use days 0 (mon) to 6 (sun) or day names, as a list, range or step"
        );
    }

    private Trigger dateTrigger(ScheduleEntry entry, ZoneId zone) {
        if (entry.runAt() == null) {
            throw new InvalidTriggerException(entry.id(), "date trigger requires run_at");
        }
        try {
            Instant runAt = Timestamps.parse(entry.runAt(), zone);
            return new DateTrigger(runAt);
        } catch (DateTimeParseException e) {
            throw new InvalidTriggerException(entry.id(), "run_at '" + entry.runAt() + "' is not an ISO-8601 timestamp", e);
        }
    }

    private Trigger intervalTrigger(ScheduleEntry entry) {
        Integer seconds = entry.intervalSeconds();
        if (seconds == null || seconds <= 0) {
            throw new InvalidTriggerException(entry.id(), "interval trigger requires positive interval_seconds");
        }
        return new IntervalTrigger(Duration.ofSeconds(seconds));
    }

    private Trigger cronTrigger(ScheduleEntry entry, ZoneId zone) {
        String expression = cronExpression(entry);
        try {
            Cron cron = QUARTZ_PARSER.parse(expression).validate();
            return new CronTrigger(expression, zone, ExecutionTime.forCron(cron));
        } catch (IllegalArgumentException e) {
            throw new InvalidTriggerException(entry.id(), "cron expression '" + expression + "' is invalid: " + e.getMessage(), e);
        }
    }

    private ZoneId zoneOf(ScheduleEntry entry) {
        if (entry.timezone() == null) {
            return defaultZone;
        }
        try {
            return ZoneId.of(entry.timezone());
        } catch (DateTimeException e) {
            throw new InvalidTriggerException(entry.id(), "unknown timezone '" + entry.timezone() + "'", e);
        }
    }

    private static void requireSinglePayload(ScheduleEntry entry) {
        List<String> foreign = new ArrayList<>();
        if (entry.triggerKind() != TriggerKind.DATE && entry.runAt() != null) {
            foreign.add("run_at");
        }
        if (entry.triggerKind() != TriggerKind.INTERVAL && entry.intervalSeconds() != null) {
            foreign.add("interval_seconds");
        }
        if (entry.triggerKind() != TriggerKind.CRON && entry.cron() != null && !entry.cron().isEmpty()) {
            foreign.add("cron");
        }
        if (!foreign.isEmpty()) {
            throw new InvalidTriggerException(
                entry.id(),
                entry.triggerKind().value() + " trigger must not carry " + String.join(", ", foreign)
            );
        }
    }
}
