package io.crewcomposer.core.schedule;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One persisted "run job J at time/interval/cron T" record.
 *
 * <p>JSON keys follow the {@code db/schedules.json} layout. {@code updatedAt} is the version
 * signal the scheduler service uses to detect edits, so only the store assigns it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScheduleEntry(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("crew") @JsonAlias("job_ref") String jobRef,
    @JsonProperty("trigger") @JsonAlias("trigger_kind") TriggerKind triggerKind,
    @JsonProperty("run_at") String runAt,
    @JsonProperty("interval_seconds") Integer intervalSeconds,
    @JsonProperty("cron") Map<String, String> cron,
    @JsonProperty("timezone") String timezone,
    @JsonProperty("enabled") Boolean enabled,
    @JsonProperty("inputs") Map<String, Object> inputs,
    @JsonProperty("created_at") @JsonDeserialize(using = UtcInstantDeserializer.class) Instant createdAt,
    @JsonProperty("updated_at") @JsonDeserialize(using = UtcInstantDeserializer.class) Instant updatedAt
) {
    public ScheduleEntry {
        id = id == null ? "" : id.trim();
        name = name == null || name.isBlank() ? id : name.trim();
        jobRef = blankToNull(jobRef);
        triggerKind = triggerKind == null ? TriggerKind.DATE : triggerKind;
        runAt = blankToNull(runAt);
        cron = cron == null ? null : copyWithoutNullValues(cron);
        timezone = blankToNull(timezone);
        enabled = enabled == null ? Boolean.TRUE : enabled;
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }

    public static ScheduleEntry ofDate(String id, String name, String runAt, Map<String, Object> inputs) {
        return new ScheduleEntry(id, name, null, TriggerKind.DATE, runAt, null, null, null, true, inputs, null, null);
    }

    public static ScheduleEntry ofInterval(String id, String name, int intervalSeconds, Map<String, Object> inputs) {
        return new ScheduleEntry(id, name, null, TriggerKind.INTERVAL, null, intervalSeconds, null, null, true, inputs, null, null);
    }

    public static ScheduleEntry ofCron(String id, String name, Map<String, String> cron, Map<String, Object> inputs) {
        return new ScheduleEntry(id, name, null, TriggerKind.CRON, null, null, cron, null, true, inputs, null, null);
    }

    public ScheduleEntry withEnabled(boolean value) {
        return new ScheduleEntry(id, name, jobRef, triggerKind, runAt, intervalSeconds, cron, timezone, value, inputs, createdAt, updatedAt);
    }

    public ScheduleEntry withJobRef(String value) {
        return new ScheduleEntry(id, name, value, triggerKind, runAt, intervalSeconds, cron, timezone, enabled, inputs, createdAt, updatedAt);
    }

    public ScheduleEntry withTimezone(String value) {
        return new ScheduleEntry(id, name, jobRef, triggerKind, runAt, intervalSeconds, cron, value, enabled, inputs, createdAt, updatedAt);
    }

    ScheduleEntry withIdentity(String newId, Instant created, Instant updated) {
        String keptName = name.equals(id) ? newId : name;
        return new ScheduleEntry(newId, keptName, jobRef, triggerKind, runAt, intervalSeconds, cron, timezone, enabled, inputs, created, updated);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Map<String, String> copyWithoutNullValues(Map<String, String> source) {
        Map<String, String> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
