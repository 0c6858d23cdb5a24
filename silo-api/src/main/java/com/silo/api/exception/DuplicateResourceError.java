package com.silo.api.exception;

/**
 * 重复定义同名资源
 */
public class DuplicateResourceError extends SiloException {

    public DuplicateResourceError(String resourceName) {
        super(resourceName, "Attempt to redefine resource '" + resourceName + "'");
    }
}
