package com.silo.core.container;

import lombok.NonNull;
import lombok.Value;

/**
 * 容器状态快照
 */
@Value
public class ContainerStats {
    int cachedCount;
    int overrideCount;
    boolean locked;
    boolean tearingDown;
    int cleanupFailureCount;

    @Override
    @NonNull
    public String toString() {
        return String.format("ContainerStats{cached=%d, overrides=%d, locked=%s, tearingDown=%s, cleanupFailures=%d}",
                cachedCount, overrideCount, locked, tearingDown, cleanupFailureCount);
    }
}
