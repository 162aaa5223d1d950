package io.crewcomposer.core.tool.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.crewcomposer.core.schedule.ScheduleEntry;
import io.crewcomposer.core.schedule.ScheduleJson;
import io.crewcomposer.core.schedule.ScheduleStore;
import io.crewcomposer.core.schedule.TriggerKind;
import io.crewcomposer.core.tool.Tool;
import io.crewcomposer.core.tool.ToolContext;
import io.crewcomposer.core.trigger.InvalidTriggerException;
import io.crewcomposer.core.trigger.TriggerBuilder;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

public final class ScheduleTool implements Tool {
    public static final String STORE_SERVICE = "scheduleStore";
    public static final String TRIGGER_BUILDER_SERVICE = "triggerBuilder";

    private final String defaultJobRef;
    private final String defaultTrigger;
    private final String defaultTimezone;
    private final ObjectMapper mapper = ScheduleJson.newMapper();

    public ScheduleTool() {
        this(null, null, null);
    }

    public ScheduleTool(String defaultJobRef, String defaultTrigger, String defaultTimezone) {
        this.defaultJobRef = defaultJobRef;
        this.defaultTrigger = defaultTrigger;
        this.defaultTimezone = defaultTimezone;
    }

    @Override
    public String name() {
        return "schedule_manager";
    }

    @Override
    public String description() {
        return "Create, update, delete, or list scheduled crew runs (upsert, delete, list)";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.ofEntries(
                Map.entry("action", Map.of("type", "string", "enum", List.of("upsert", "delete", "list"))),
                Map.entry("id", Map.of("type", "string")),
                Map.entry("name", Map.of("type", "string")),
                Map.entry("crew", Map.of("type", "string")),
                Map.entry("trigger", Map.of("type", "string", "enum", List.of("date", "interval", "cron"))),
                Map.entry("run_at", Map.of("type", "string")),
                Map.entry("interval_seconds", Map.of("type", "integer")),
                Map.entry("cron", Map.of("type", "object")),
                Map.entry("timezone", Map.of("type", "string")),
                Map.entry("enabled", Map.of("type", "boolean")),
                Map.entry("inputs", Map.of("type", "object"))
            ),
            "required", new String[] {"action"}
        );
    }

    @Override
    public String execute(Map<String, Object> input, ToolContext context) {
        String action = String.valueOf(input.getOrDefault("action", "")).trim().toLowerCase(Locale.ROOT);
        ScheduleStore store = context.service(STORE_SERVICE, ScheduleStore.class);
        if (store == null) {
            return "Error: schedule store is not configured";
        }
        TriggerBuilder triggerBuilder = context.service(TRIGGER_BUILDER_SERVICE, TriggerBuilder.class);
        if (triggerBuilder == null) {
            triggerBuilder = new TriggerBuilder();
        }

        try {
            return switch (action) {
                case "list" -> mapper.writerWithDefaultPrettyPrinter().writeValueAsString(store.list());
                case "delete" -> delete(store, input);
                case "upsert" -> upsert(store, triggerBuilder, input);
                case "" -> "Error: action is required (upsert, delete, list)";
                default -> "Error: unsupported action: " + action;
            };
        } catch (Exception e) {
            return "Error: " + e.getMessage();
        }
    }

    private String delete(ScheduleStore store, Map<String, Object> input) throws Exception {
        String id = text(input, "id", null);
        if (id == null) {
            return "Error: id is required for delete";
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("deleted", store.delete(id));
        result.put("id", id);
        return mapper.writeValueAsString(result);
    }

    private String upsert(ScheduleStore store, TriggerBuilder triggerBuilder, Map<String, Object> input) throws Exception {
        TriggerKind kind;
        try {
            kind = TriggerKind.fromValue(text(input, "trigger", defaultTrigger));
        } catch (IllegalArgumentException e) {
            return "Error: " + e.getMessage();
        }
        if (input.get("cron") != null && !(input.get("cron") instanceof Map)) {
            return "Error: cron must be an object of cron fields";
        }
        if (input.get("inputs") != null && !(input.get("inputs") instanceof Map)) {
            return "Error: inputs must be an object";
        }

        String id = text(input, "id", null);
        ScheduleEntry entry = new ScheduleEntry(
            id == null ? UUID.randomUUID().toString() : id,
            text(input, "name", null),
            text(input, "crew", text(input, "job_ref", defaultJobRef)),
            kind,
            text(input, "run_at", null),
            integer(input.get("interval_seconds")),
            cronFields(input.get("cron")),
            text(input, "timezone", defaultTimezone),
            bool(input.get("enabled")),
            inputs(input.get("inputs")),
            null,
            null
        );
        try {
            triggerBuilder.build(entry);
        } catch (InvalidTriggerException e) {
            return "Error: " + e.getMessage();
        }
        ScheduleEntry saved = store.upsert(entry);
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(saved);
    }

    private static String text(Map<String, Object> input, String key, String fallback) {
        Object value = input.get(key);
        if (value == null || String.valueOf(value).isBlank()) {
            return fallback == null || fallback.isBlank() ? null : fallback;
        }
        return String.valueOf(value).trim();
    }

    private static Integer integer(Object value) {
        if (value == null || String.valueOf(value).isBlank()) {
            return null;
        }
        try {
            BigDecimal number = value instanceof Number
                ? new BigDecimal(value.toString())
                : new BigDecimal(String.valueOf(value).trim());
            return number.intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("interval_seconds must be an integer: " + value, e);
        }
    }

    private static Boolean bool(Object value) {
        if (value == null) {
            return Boolean.TRUE;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        return Boolean.parseBoolean(String.valueOf(value).trim());
    }

    private static Map<String, String> cronFields(Object value) {
        if (value == null) {
            return null;
        }
        Map<String, String> fields = new LinkedHashMap<>();
        ((Map<?, ?>) value).forEach((key, field) -> {
            if (key != null && field != null) {
                fields.put(String.valueOf(key), String.valueOf(field));
            }
        });
        return fields;
    }

    private static Map<String, Object> inputs(Object value) {
        if (value == null) {
            return Map.of();
        }
        Map<String, Object> inputs = new LinkedHashMap<>();
        ((Map<?, ?>) value).forEach((key, item) -> inputs.put(String.valueOf(key), item));
        return inputs;
    }
}
