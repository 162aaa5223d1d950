package io.crewcomposer.core.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum TriggerKind {
    DATE("date"),
    INTERVAL("interval"),
    CRON("cron");

    private final String value;

    TriggerKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TriggerKind fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return DATE;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TriggerKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported trigger: " + raw + ". Must be one of: date, interval, cron");
    }
}
