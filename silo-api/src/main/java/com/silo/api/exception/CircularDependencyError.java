package com.silo.api.exception;

import java.util.List;

/**
 * 初始化链路上出现环
 * <p>
 * 对当前解析链是致命的，不会自动重试
 */
public class CircularDependencyError extends SiloException {

    private final String key;
    private final List<String> pendingKeys;

    public CircularDependencyError(String resourceName, String key, List<String> pendingKeys, String location) {
        super(resourceName, "Circular dependency detected for resource " + key
                + ": {" + String.join(", ", pendingKeys) + "}"
                + (location != null ? " at " + location : ""));
        this.key = key;
        this.pendingKeys = List.copyOf(pendingKeys);
    }

    /**
     * 触发环检测的缓存键
     */
    public String getKey() {
        return key;
    }

    /**
     * 检测时正在解析的全部缓存键（已排序）
     */
    public List<String> getPendingKeys() {
        return pendingKeys;
    }
}
