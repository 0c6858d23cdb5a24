package com.silo.api.resource;

import com.silo.api.container.Silo;

/**
 * 资源初始化函数
 * <p>
 * 初始化函数可以通过 {@code silo} 再次获取其它资源（可重入），
 * 但不能获取自身正在解析中的缓存键，否则视为循环依赖。
 *
 * @param <T> 资源类型
 */
@FunctionalInterface
public interface ResourceInitializer<T> {

    /**
     * 创建资源实例
     *
     * @param silo     当前容器
     * @param name     资源名
     * @param argument 资源参数，未提供时为空串
     * @return 资源实例
     * @throws Exception 受检异常会被容器包装为 {@link com.silo.api.exception.ResourceInitError}
     */
    T init(Silo silo, String name, String argument) throws Exception;

    /**
     * 返回固定值的初始化函数
     */
    static <T> ResourceInitializer<T> constant(T value) {
        return (silo, name, argument) -> value;
    }
}
