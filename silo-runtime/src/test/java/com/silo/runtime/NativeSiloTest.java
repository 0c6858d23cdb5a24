package com.silo.runtime;

import com.silo.api.exception.LockedModeError;
import com.silo.api.exception.MissingDependencyError;
import com.silo.api.exception.ResourceInitError;
import com.silo.api.exception.TeardownInProgressError;
import com.silo.api.resource.ResourceCleanup;
import com.silo.core.config.SiloConfig;
import com.silo.core.container.ResourceContainer;
import com.silo.core.registry.ResourceRegistry;
import com.silo.core.spec.ResourceSpec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("NativeSilo 启动器测试")
class NativeSiloTest {

    @Mock
    private ResourceCleanup<Object> cleanup;

    @AfterEach
    void tearDown() {
        NativeSilo.shutdown();
    }

    private ResourceRegistry registry(AtomicInteger inits) {
        return new ResourceRegistry()
                .register(ResourceSpec.builder("config").literal("cfg").build())
                .register(ResourceSpec.builder("pool")
                        .init((silo, name, arg) -> "pool#" + inits.incrementAndGet())
                        .cleanup(cleanup)
                        .dependencies("config")
                        .preload(true)
                        .build());
    }

    @Test
    @DisplayName("启动时预加载，重复启动返回同一容器")
    void startShouldPreloadAndBeIdempotent() {
        AtomicInteger inits = new AtomicInteger();
        ResourceRegistry registry = registry(inits);

        ResourceContainer container = NativeSilo.start(registry);

        assertTrue(NativeSilo.isStarted());
        assertSame(container, NativeSilo.current());
        assertEquals("pool#1", container.cached("pool"));
        assertSame(container, NativeSilo.start(registry));
        assertEquals(1, inits.get());
    }

    @Test
    @DisplayName("未启动时访问 current 失败")
    void currentShouldFailBeforeStart() {
        assertFalse(NativeSilo.isStarted());
        assertThrows(IllegalStateException.class, NativeSilo::current);
    }

    @Test
    @DisplayName("shutdown 清理资源")
    void shutdownShouldCleanup() throws Exception {
        ResourceContainer container = NativeSilo.start(registry(new AtomicInteger()));

        NativeSilo.shutdown();

        verify(cleanup).cleanup("pool#1");
        assertFalse(NativeSilo.isStarted());
        assertThrows(TeardownInProgressError.class, () -> container.get("pool"));
    }

    @Test
    @DisplayName("自检失败时不启动")
    void selfCheckFailureShouldAbortStart() {
        ResourceRegistry registry = new ResourceRegistry()
                .register(ResourceSpec.builder("app").init((silo, name, arg) -> 1).dependencies("dbh").build());

        assertThrows(MissingDependencyError.class, () -> NativeSilo.start(registry));
        assertFalse(NativeSilo.isStarted());
    }

    @Test
    @DisplayName("预加载失败时清理已创建的资源")
    void preloadFailureShouldTearDown() throws Exception {
        ResourceRegistry registry = registry(new AtomicInteger())
                .register(ResourceSpec.builder("broken")
                        .init((silo, name, arg) -> {
                            throw new java.io.IOException("connection refused");
                        })
                        .preload(true)
                        .build());

        assertThrows(ResourceInitError.class, () -> NativeSilo.start(registry));

        verify(cleanup).cleanup("pool#1");
        assertFalse(NativeSilo.isStarted());
    }

    @Test
    @DisplayName("预加载后锁定")
    void lockAfterPreload() {
        ResourceRegistry registry = registry(new AtomicInteger())
                .register(ResourceSpec.builder("lazy").init((silo, name, arg) -> "late").build());
        SiloConfig config = SiloConfig.testing().toBuilder().preloadOnStart(true).build();

        ResourceContainer container = NativeSilo.start(registry, config);

        assertTrue(container.control().isLocked());
        assertEquals("pool#1", container.get("pool"));
        assertThrows(LockedModeError.class, () -> container.get("lazy"));
        assertEquals("cfg", container.get("config"));
    }
}
