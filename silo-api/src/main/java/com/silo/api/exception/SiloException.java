package com.silo.api.exception;

/**
 * 资源容器异常基类
 * <p>
 * 所有异常均为非受检异常，并携带出错的资源名称（注册期或运行期）
 */
public class SiloException extends RuntimeException {

    private final String resourceName;

    public SiloException(String resourceName, String message) {
        super(message);
        this.resourceName = resourceName;
    }

    public SiloException(String resourceName, String message, Throwable cause) {
        super(message, cause);
        this.resourceName = resourceName;
    }

    public String getResourceName() {
        return resourceName;
    }
}
