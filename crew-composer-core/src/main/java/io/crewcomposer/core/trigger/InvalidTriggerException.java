package io.crewcomposer.core.trigger;

public final class InvalidTriggerException extends IllegalArgumentException {
    private final String scheduleId;

    public InvalidTriggerException(String scheduleId, String detail) {
        this(scheduleId, detail, null);
    }

    public InvalidTriggerException(String scheduleId, String detail, Throwable cause) {
        super("Invalid trigger for schedule '" + scheduleId + "': " + detail, cause);
        this.scheduleId = scheduleId;
    }

    public String scheduleId() {
        return scheduleId;
    }
}
