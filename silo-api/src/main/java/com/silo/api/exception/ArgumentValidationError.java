package com.silo.api.exception;

/**
 * 资源参数未通过校验
 */
public class ArgumentValidationError extends SiloException {

    private final String argument;

    public ArgumentValidationError(String resourceName, String argument) {
        super(resourceName, "Argument check failed for resource '" + resourceName + "': '" + argument + "'");
        this.argument = argument;
    }

    public String getArgument() {
        return argument;
    }
}
