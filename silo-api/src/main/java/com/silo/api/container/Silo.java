package com.silo.api.container;

/**
 * 资源容器
 * <p>
 * 按名称（及可选参数）懒加载资源并缓存，管理其清理顺序。
 * 管理类操作统一通过 {@link #control()} 暴露，避免占用资源访问的命名空间。
 *
 * @author Silo
 */
public interface Silo extends AutoCloseable {

    /**
     * 获取无参数资源，必要时初始化
     */
    Object get(String name);

    /**
     * 获取资源，必要时初始化
     *
     * @param name     资源名
     * @param argument 参数，须为标量；null 视为空串
     */
    Object get(String name, Object argument);

    /**
     * 创建一个新实例，既不读取也不写入缓存
     */
    Object fresh(String name);

    Object fresh(String name, Object argument);

    /**
     * 只读地查询缓存，从不初始化
     *
     * @return 缓存的值，不存在时返回 null
     */
    Object cached(String name);

    Object cached(String name, Object argument);

    /**
     * 管理门面
     */
    SiloControl control();

    /**
     * 销毁容器，等价于 {@code control().cleanup()}
     */
    @Override
    void close();
}
