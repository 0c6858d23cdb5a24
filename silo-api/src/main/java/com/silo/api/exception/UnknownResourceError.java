package com.silo.api.exception;

/**
 * 访问、覆盖或预置了未注册的资源
 */
public class UnknownResourceError extends SiloException {

    public UnknownResourceError(String resourceName) {
        super(resourceName, "Unknown resource '" + resourceName + "'");
    }

    public UnknownResourceError(String resourceName, String message) {
        super(resourceName, message);
    }
}
