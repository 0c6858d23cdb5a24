package com.silo.api.container;

import com.silo.api.resource.CleanupFailure;
import com.silo.api.resource.ResourceInitializer;

import java.util.List;
import java.util.Map;

/**
 * 容器管理门面
 * <p>
 * 只持有对容器的引用，自身无状态。所有修改操作返回门面本身以便链式调用。
 */
public interface SiloControl {

    /**
     * 用初始化函数覆盖资源（通常用于测试 mock）
     * <p>
     * 会先按正常清理语义驱逐该资源所有参数下的缓存。
     */
    SiloControl override(String name, ResourceInitializer<?> initializer);

    /**
     * 用固定值覆盖资源；若 value 本身是 {@link ResourceInitializer} 则按初始化函数处理
     */
    SiloControl override(String name, Object value);

    /**
     * 批量覆盖
     */
    SiloControl override(Map<String, ?> overrides);

    /**
     * 驱逐被覆盖资源的缓存并移除全部覆盖
     */
    SiloControl clearOverrides();

    /**
     * 锁定：禁止初始化新的资源（已缓存、已覆盖、派生资源除外）
     */
    SiloControl lock();

    SiloControl unlock();

    boolean isLocked();

    /**
     * 直接设置或清除缓存，不执行 init
     *
     * @param name    资源名
     * @param payload null 清除；单元素 List 表示无参数槽位；
     *                偶数长度 List 为参数/值对（空 List 不做任何修改）；Map 为参数到值的映射
     */
    SiloControl setCache(String name, Object payload);

    SiloControl setCache(Map<String, ?> payloads);

    /**
     * 丢弃全部缓存，不调用任何清理函数；覆盖与锁定状态保持不变
     */
    SiloControl cleanCache();

    /**
     * 按注册顺序加载所有标记了 preload 的资源
     */
    SiloControl preload();

    /**
     * 按 cleanup order 升序销毁全部缓存，之后容器不可再用于初始化
     */
    SiloControl cleanup();

    /**
     * 容器生命周期内收集到的全部清理失败（只读快照）
     */
    List<CleanupFailure> getCleanupFailures();
}
