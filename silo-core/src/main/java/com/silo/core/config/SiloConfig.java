package com.silo.core.config;

import lombok.Builder;
import lombok.Getter;

/**
 * 容器运行时配置
 */
@Getter
@Builder(toBuilder = true)
public class SiloConfig {

    /**
     * fork 检测策略
     */
    @Builder.Default
    private ForkDetection forkDetection = ForkDetection.PROCESS;

    /**
     * 启动时执行注册表自检
     */
    @Builder.Default
    private boolean selfCheckOnStart = true;

    /**
     * 启动时预加载 preload 资源
     */
    @Builder.Default
    private boolean preloadOnStart = true;

    /**
     * 预加载完成后锁定容器
     */
    @Builder.Default
    private boolean lockAfterPreload = false;

    /**
     * 注册 JVM 关闭钩子，退出时销毁容器
     */
    @Builder.Default
    private boolean registerShutdownHook = true;

    // ==================== 工厂方法 ====================

    /**
     * 默认配置
     */
    public static SiloConfig defaults() {
        return SiloConfig.builder().build();
    }

    /**
     * 生产配置：预加载后锁定，运行期不再初始化未预加载的资源
     */
    public static SiloConfig production() {
        return SiloConfig.builder()
                .forkDetection(ForkDetection.PROCESS)
                .selfCheckOnStart(true)
                .preloadOnStart(true)
                .lockAfterPreload(true)
                .registerShutdownHook(true)
                .build();
    }

    /**
     * 测试配置：不预加载，启动即锁定，只允许覆盖过的或派生资源初始化
     */
    public static SiloConfig testing() {
        return SiloConfig.builder()
                .forkDetection(ForkDetection.NONE)
                .preloadOnStart(false)
                .lockAfterPreload(true)
                .registerShutdownHook(false)
                .build();
    }

    @Override
    public String toString() {
        return String.format(
                "SiloConfig{forkDetection=%s, selfCheck=%s, preload=%s, lock=%s, shutdownHook=%s}",
                forkDetection, selfCheckOnStart, preloadOnStart, lockAfterPreload, registerShutdownHook);
    }
}
