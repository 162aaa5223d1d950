package io.crewcomposer.core.schedule;

import java.io.IOException;
import java.util.List;

public interface ScheduleStore {
    List<ScheduleEntry> list();

    ScheduleEntry upsert(ScheduleEntry entry) throws IOException;

    boolean delete(String id) throws IOException;

    StoreRevision revision() throws IOException;
}
