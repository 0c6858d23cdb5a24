package com.silo.api.exception;

/**
 * setCache 的载荷格式不合法
 */
public class InvalidCacheValueError extends SiloException {

    public InvalidCacheValueError(String resourceName, String message) {
        super(resourceName, "set_cache for resource '" + resourceName + "': " + message);
    }
}
