package com.silo.api.exception;

/**
 * 锁定模式下初始化了既未覆盖、也非派生的资源
 */
public class LockedModeError extends SiloException {

    public LockedModeError(String resourceName) {
        super(resourceName, "Attempting to initialize resource '" + resourceName + "' in locked mode");
    }
}
