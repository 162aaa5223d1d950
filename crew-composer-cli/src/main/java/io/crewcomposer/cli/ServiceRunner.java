package io.crewcomposer.cli;

@FunctionalInterface
public interface ServiceRunner {
    int run(Integer pollSecondsOverride) throws Exception;
}
