package com.silo.api.exception;

/**
 * 资源声明不合法
 * <p>
 * 仅影响当前这一条声明，注册表其余内容不受影响
 */
public class InvalidSpecError extends SiloException {

    private final String field;

    public InvalidSpecError(String resourceName, String field, String message) {
        super(resourceName, "resource '" + resourceName + "': " + message);
        this.field = field;
    }

    /**
     * 出错的声明字段，例如 {@code cleanup_order}
     */
    public String getField() {
        return field;
    }
}
