package io.crewcomposer.core.job;

public final class JobExecutionException extends Exception {
    private final String output;

    public JobExecutionException(String message, String output) {
        super(message);
        this.output = output == null ? "" : output;
    }

    public String output() {
        return output;
    }

    @Override
    public String getMessage() {
        if (output.isBlank()) {
            return super.getMessage();
        }
        return super.getMessage() + "\n" + output;
    }
}
