package com.calldash.calldash.data;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Process-wide slot for the dataset merged from the active registry files.
 * Rebuilds are not locked: concurrent callers may each rebuild, and a rebuild that
 * started before an invalidation is returned to its caller but never installed.
 */
@Component
public class MergeCache {

    private final AtomicReference<Slot> slot = new AtomicReference<>(new Slot(0L, null));

    public Dataset get() {
        return slot.get().dataset();
    }

    public Dataset getOrRebuild(Supplier<Dataset> rebuild) {
        Dataset cached = get();
        if (cached != null) {
            return cached;
        }
        return rebuild(rebuild);
    }

    public Dataset rebuild(Supplier<Dataset> rebuild) {
        Slot startedFrom = slot.get();
        Dataset rebuilt = rebuild.get();
        // Installs only if no invalidation or other install happened since startedFrom was read.
        slot.compareAndSet(startedFrom, new Slot(startedFrom.epoch(), rebuilt));
        return rebuilt;
    }

    public void invalidate() {
        slot.updateAndGet(current -> new Slot(current.epoch() + 1, null));
    }

    private record Slot(long epoch, Dataset dataset) {
    }
}
