package com.silo.api.resource;

import lombok.NonNull;
import lombok.Value;

/**
 * 一次失败的清理调用
 * <p>
 * 清理是尽力而为的：失败会被记录下来，但不会中断剩余条目的清理
 */
@Value
public class CleanupFailure {
    String resourceName;
    String argument;
    boolean forked;
    Throwable error;

    @Override
    @NonNull
    public String toString() {
        return String.format("CleanupFailure{resource=%s, argument='%s', forked=%s, error=%s}",
                resourceName, argument, forked, error);
    }
}
