package io.crewcomposer.core.schedule;

import java.io.IOException;

@FunctionalInterface
public interface StoreLock {
    Lease acquire() throws IOException;

    @FunctionalInterface
    interface Lease extends AutoCloseable {
        @Override
        void close() throws IOException;
    }
}
