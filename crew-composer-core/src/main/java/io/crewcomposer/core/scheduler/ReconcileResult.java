package io.crewcomposer.core.scheduler;

import java.util.List;

public record ReconcileResult(List<String> added, List<String> rebuilt, List<String> removed, List<String> invalid) {
    public ReconcileResult {
        added = List.copyOf(added);
        rebuilt = List.copyOf(rebuilt);
        removed = List.copyOf(removed);
        invalid = List.copyOf(invalid);
    }

    public boolean hasChanges() {
        return !added.isEmpty() || !rebuilt.isEmpty() || !removed.isEmpty();
    }
}
