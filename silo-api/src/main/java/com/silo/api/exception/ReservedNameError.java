package com.silo.api.exception;

/**
 * 资源名与容器自身的操作名冲突
 */
public class ReservedNameError extends SiloException {

    public ReservedNameError(String resourceName) {
        super(resourceName, "Attempt to replace existing container method '" + resourceName + "'");
    }
}
