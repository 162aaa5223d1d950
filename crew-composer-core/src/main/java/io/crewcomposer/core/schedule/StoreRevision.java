package io.crewcomposer.core.schedule;

import java.nio.file.attribute.FileTime;

/**
 * Cheap change marker for the backing file. Every write replaces the file by rename, so the
 * file key changes even when two writes land within the same modification-time tick.
 */
public record StoreRevision(FileTime lastModified, Object fileKey, long size) {
    public static final StoreRevision MISSING = new StoreRevision(FileTime.fromMillis(0), null, -1);
}
