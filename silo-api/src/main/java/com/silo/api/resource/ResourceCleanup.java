package com.silo.api.resource;

/**
 * 资源清理函数
 * <p>
 * 接收的正是此前由初始化函数产生并缓存的实例，负责释放其持有的资源。
 *
 * @param <T> 资源类型
 */
@FunctionalInterface
public interface ResourceCleanup<T> {

    void cleanup(T instance) throws Exception;
}
