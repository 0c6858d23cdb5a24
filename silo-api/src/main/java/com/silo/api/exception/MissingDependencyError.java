package com.silo.api.exception;

/**
 * 声明的依赖未注册（或注册顺序不满足要求）
 */
public class MissingDependencyError extends SiloException {

    private final String dependency;

    public MissingDependencyError(String resourceName, String dependency, String message) {
        super(resourceName, "resource '" + resourceName + "': " + message);
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}
