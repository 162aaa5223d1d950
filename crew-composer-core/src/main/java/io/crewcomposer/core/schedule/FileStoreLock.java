package io.crewcomposer.core.schedule;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive lock on a marker file. The JVM-wide lock serializes threads (file locks are held
 * per process), the channel lock serializes processes. The OS drops the channel lock when its
 * holder dies. Not reentrant.
 */
public final class FileStoreLock implements StoreLock {
    private static final ConcurrentMap<Path, ReentrantLock> LOCAL_LOCKS = new ConcurrentHashMap<>();

    private final Path lockPath;
    private final ReentrantLock localLock;

    public FileStoreLock(Path lockPath) {
        this.lockPath = lockPath.toAbsolutePath().normalize();
        this.localLock = LOCAL_LOCKS.computeIfAbsent(this.lockPath, ignored -> new ReentrantLock());
    }

    public Path path() {
        return lockPath;
    }

    @Override
    public Lease acquire() throws IOException {
        localLock.lock();
        FileChannel channel = null;
        try {
            Files.createDirectories(lockPath.getParent());
            channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock fileLock = channel.lock();
            FileChannel held = channel;
            return () -> {
                try {
                    fileLock.release();
                } finally {
                    try {
                        held.close();
                    } finally {
                        localLock.unlock();
                    }
                }
            };
        } catch (IOException | RuntimeException e) {
            if (channel != null) {
                try {
                    channel.close();
                } catch (IOException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            localLock.unlock();
            throw e;
        }
    }
}
