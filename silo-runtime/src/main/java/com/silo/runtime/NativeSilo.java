package com.silo.runtime;

import com.silo.api.exception.SiloException;
import com.silo.core.config.SiloConfig;
import com.silo.core.config.SiloConfigLoader;
import com.silo.core.container.ResourceContainer;
import com.silo.core.registry.ResourceRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Silo 启动器
 * <p>
 * 为一个注册表创建进程级的容器：按配置自检、预加载、锁定，并在 JVM 退出时销毁。
 * 重复启动返回已有容器。
 */
@Slf4j
public class NativeSilo {

    private static final Object MONITOR = new Object();
    private static ResourceContainer globalContainer;
    private static Thread shutdownHook;

    private NativeSilo() {
    }

    /**
     * 启动（使用 classpath 上的 silo.yml，不存在则用默认配置）
     */
    public static ResourceContainer start(ResourceRegistry registry) {
        return start(registry, SiloConfigLoader.load());
    }

    /**
     * 启动（自定义配置）
     */
    public static ResourceContainer start(ResourceRegistry registry, SiloConfig config) {
        synchronized (MONITOR) {
            if (globalContainer != null) {
                log.warn("Silo is already started.");
                return globalContainer;
            }

            long start = System.currentTimeMillis();
            log.info("Starting Silo with {} resource(s), {}", registry.size(), config);

            if (config.isSelfCheckOnStart()) {
                registry.selfCheck();
            }

            ResourceContainer container = new ResourceContainer(
                    registry, null, config.getForkDetection().createProbe());

            if (config.isPreloadOnStart()) {
                try {
                    container.control().preload();
                } catch (SiloException e) {
                    log.error("Preload failed, tearing down partially initialized container", e);
                    container.close();
                    throw e;
                }
            }
            if (config.isLockAfterPreload()) {
                container.control().lock();
            }

            if (config.isRegisterShutdownHook()) {
                shutdownHook = new Thread(() -> {
                    log.info("Silo shutting down...");
                    container.close();
                }, "silo-shutdown");
                Runtime.getRuntime().addShutdownHook(shutdownHook);
            }

            globalContainer = container;
            log.info("Silo started in {} ms", System.currentTimeMillis() - start);
            return container;
        }
    }

    /**
     * 当前进程级容器
     *
     * @throws IllegalStateException 尚未启动
     */
    public static ResourceContainer current() {
        synchronized (MONITOR) {
            if (globalContainer == null) {
                throw new IllegalStateException("Silo is not started");
            }
            return globalContainer;
        }
    }

    public static boolean isStarted() {
        synchronized (MONITOR) {
            return globalContainer != null;
        }
    }

    /**
     * 销毁进程级容器并移除关闭钩子
     */
    public static void shutdown() {
        synchronized (MONITOR) {
            if (globalContainer == null) {
                return;
            }
            if (shutdownHook != null) {
                try {
                    Runtime.getRuntime().removeShutdownHook(shutdownHook);
                } catch (IllegalStateException e) {
                    log.debug("JVM already shutting down, hook stays registered");
                }
                shutdownHook = null;
            }
            globalContainer.close();
            globalContainer = null;
            log.info("Silo shutdown complete");
        }
    }
}
