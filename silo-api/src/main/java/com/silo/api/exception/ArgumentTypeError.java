package com.silo.api.exception;

/**
 * 资源参数不是标量
 */
public class ArgumentTypeError extends SiloException {

    private final transient Object argument;

    public ArgumentTypeError(String resourceName, Object argument) {
        super(resourceName, "Argument for resource '" + resourceName + "' must be a scalar, got "
                + argument.getClass().getName());
        this.argument = argument;
    }

    public Object getArgument() {
        return argument;
    }
}
