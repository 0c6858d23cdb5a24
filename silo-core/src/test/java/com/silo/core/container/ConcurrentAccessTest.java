package com.silo.core.container;

import com.silo.core.generation.EpochGenerationProbe;
import com.silo.core.registry.ResourceRegistry;
import com.silo.core.spec.ResourceSpec;
import com.silo.core.spi.GenerationProbe;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("并发访问测试")
class ConcurrentAccessTest {

    private static final int THREADS = 8;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("多线程同时访问同一资源，init 只执行一次")
    void concurrentGetShouldInitOnce() throws Exception {
        AtomicInteger inits = new AtomicInteger();
        ResourceRegistry registry = new ResourceRegistry()
                .register(ResourceSpec.builder("slow")
                        .init((silo, name, arg) -> {
                            inits.incrementAndGet();
                            Thread.sleep(20);
                            return new Object();
                        })
                        .build());
        ResourceContainer container = new ResourceContainer(registry, null, GenerationProbe.none());
        CountDownLatch start = new CountDownLatch(1);

        List<Future<Object>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return container.get("slow");
            }));
        }
        start.countDown();

        Set<Object> instances = new HashSet<>();
        for (Future<Object> future : futures) {
            instances.add(future.get(5, TimeUnit.SECONDS));
        }

        assertEquals(1, inits.get());
        assertEquals(1, instances.size());
    }

    @Test
    @DisplayName("fork 后多线程同时访问，每个过期条目只清理一次")
    void concurrentAccessAfterForkShouldCleanupOnce() throws Exception {
        AtomicInteger cleanups = new AtomicInteger();
        AtomicInteger inits = new AtomicInteger();
        EpochGenerationProbe probe = new EpochGenerationProbe();
        ResourceRegistry registry = new ResourceRegistry()
                .register(ResourceSpec.builder("conn")
                        .init((silo, name, arg) -> "conn#" + inits.incrementAndGet())
                        .cleanup(value -> cleanups.incrementAndGet())
                        .build());
        ResourceContainer container = new ResourceContainer(registry, null, probe);
        int rounds = 20;

        for (int round = 0; round < rounds; round++) {
            container.get("conn");
            probe.advance();

            CountDownLatch start = new CountDownLatch(1);
            List<Future<Object>> futures = new ArrayList<>();
            for (int i = 0; i < THREADS; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return container.get("conn");
                }));
            }
            start.countDown();

            Set<Object> instances = new HashSet<>();
            for (Future<Object> future : futures) {
                instances.add(future.get(5, TimeUnit.SECONDS));
            }
            assertEquals(1, instances.size());
            assertEquals(round + 1, cleanups.get());
        }

        assertEquals(rounds, cleanups.get());
        assertEquals(rounds + 1, inits.get());
    }
}
