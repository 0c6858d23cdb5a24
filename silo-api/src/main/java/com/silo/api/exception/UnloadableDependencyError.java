package com.silo.api.exception;

/**
 * require 声明的类无法加载
 */
public class UnloadableDependencyError extends SiloException {

    private final String dependency;

    public UnloadableDependencyError(String resourceName, String dependency, Throwable cause) {
        super(resourceName, "resource '" + resourceName + "': failed to load required class '"
                + dependency + "'", cause);
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}
