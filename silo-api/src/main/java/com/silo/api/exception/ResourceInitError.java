package com.silo.api.exception;

/**
 * 初始化函数抛出了受检异常
 * <p>
 * 运行时异常原样抛出，不经过此包装
 */
public class ResourceInitError extends SiloException {

    private final String argument;

    public ResourceInitError(String resourceName, String argument, Throwable cause) {
        super(resourceName, "Failed to initialize resource '" + resourceName + "'"
                + (argument == null || argument.isEmpty() ? "" : " with argument '" + argument + "'")
                + ": " + cause.getMessage(), cause);
        this.argument = argument;
    }

    public String getArgument() {
        return argument;
    }
}
