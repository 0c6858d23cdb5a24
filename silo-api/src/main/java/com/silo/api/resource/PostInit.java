package com.silo.api.resource;

import com.silo.api.container.Silo;

/**
 * 初始化后置处理
 * <p>
 * 对 init 或测试覆盖产生的原始值做校验/转换，返回值即为最终缓存的值。
 *
 * @param <T> 资源类型
 */
@FunctionalInterface
public interface PostInit<T> {

    T apply(T value, Silo silo) throws Exception;
}
