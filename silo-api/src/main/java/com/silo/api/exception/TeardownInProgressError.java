package com.silo.api.exception;

/**
 * 容器已开始销毁
 */
public class TeardownInProgressError extends SiloException {

    public TeardownInProgressError(String resourceName) {
        super(resourceName, resourceName == null
                ? "Container teardown in progress"
                : "Attempting to access resource '" + resourceName + "' while container teardown is in progress");
    }
}
