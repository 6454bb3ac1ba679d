package com.calldash.calldash.data;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user enriched views, kept apart from the registry-derived {@link MergeCache}.
 */
@Component
public class WorkingViewCache {

    private final Map<Long, Dataset> views = new ConcurrentHashMap<>();

    public Optional<Dataset> get(long userId) {
        return Optional.ofNullable(views.get(userId));
    }

    public void put(long userId, Dataset dataset) {
        views.put(userId, dataset);
    }

    public void discard(long userId) {
        views.remove(userId);
    }

    /**
     * Drops every view; called whenever the registered file set changes.
     */
    public void clear() {
        views.clear();
    }
}
