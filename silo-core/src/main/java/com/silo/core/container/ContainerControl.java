package com.silo.core.container;

import com.silo.api.container.SiloControl;
import com.silo.api.exception.InvalidCacheValueError;
import com.silo.api.exception.TeardownInProgressError;
import com.silo.api.exception.UnknownResourceError;
import com.silo.api.resource.CleanupFailure;
import com.silo.api.resource.ResourceInitializer;
import com.silo.core.spec.ResourceSpec;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 容器管理门面
 * <p>
 * 每次 {@code control()} 都会新建，只持有容器引用，不保存任何自身状态。
 */
@Slf4j
public class ContainerControl implements SiloControl {

    private final ResourceContainer container;

    ContainerControl(ResourceContainer container) {
        this.container = container;
    }

    // ==================== 覆盖 ====================

    @Override
    public ContainerControl override(String name, ResourceInitializer<?> initializer) {
        return override(Collections.singletonMap(name, initializer));
    }

    @Override
    public ContainerControl override(String name, Object value) {
        return override(Collections.singletonMap(name, value));
    }

    @Override
    public ContainerControl override(Map<String, ?> overrides) {
        container.runLocked(() -> {
            for (String name : overrides.keySet()) {
                if (!container.getRegistry().contains(name)) {
                    throw new UnknownResourceError(name, "Attempt to override unknown resource '" + name + "'");
                }
            }
            container.checkGeneration();
            for (Map.Entry<String, ?> entry : overrides.entrySet()) {
                String name = entry.getKey();
                container.evict(name, false);
                container.overrides.put(name, toInitializer(entry.getValue()));
                log.info("[{}] Resource overridden", name);
            }
        });
        return this;
    }

    @Override
    public ContainerControl clearOverrides() {
        container.runLocked(() -> {
            container.checkGeneration();
            for (String name : container.evictionOrder(container.overrides.keySet())) {
                container.evict(name, false);
            }
            log.info("Cleared {} override(s)", container.overrides.size());
            container.overrides.clear();
        });
        return this;
    }

    @SuppressWarnings("unchecked")
    private static ResourceInitializer<Object> toInitializer(Object value) {
        if (value instanceof ResourceInitializer) {
            return (ResourceInitializer<Object>) value;
        }
        return ResourceInitializer.constant(value);
    }

    // ==================== 锁定 ====================

    @Override
    public ContainerControl lock() {
        container.runLocked(() -> container.locked = true);
        log.debug("Container locked");
        return this;
    }

    @Override
    public ContainerControl unlock() {
        container.runLocked(() -> container.locked = false);
        log.debug("Container unlocked");
        return this;
    }

    @Override
    public boolean isLocked() {
        return container.withLock(() -> container.locked);
    }

    // ==================== 缓存预置 ====================

    @Override
    public ContainerControl setCache(String name, Object payload) {
        return setCache(Collections.singletonMap(name, payload));
    }

    @Override
    public ContainerControl setCache(Map<String, ?> payloads) {
        container.runLocked(() -> {
            // 全部校验通过后再写入
            Map<String, Map<String, Object>> resolved = new LinkedHashMap<>();
            for (Map.Entry<String, ?> entry : payloads.entrySet()) {
                String name = entry.getKey();
                ResourceSpec spec = container.getRegistry().lookup(name).orElseThrow(
                        () -> new UnknownResourceError(name, "Attempt to set unknown resource '" + name + "'"));
                if (container.tearingDown) {
                    throw new TeardownInProgressError(name);
                }
                resolved.put(name, toSlots(spec, entry.getValue()));
            }

            container.checkGeneration();
            for (Map.Entry<String, Map<String, Object>> entry : resolved.entrySet()) {
                String name = entry.getKey();
                if (entry.getValue() == null) {
                    container.cache.remove(name);
                    log.debug("[{}] Cache cleared", name);
                    continue;
                }
                for (Map.Entry<String, Object> slot : entry.getValue().entrySet()) {
                    container.cache.put(name, slot.getKey(), slot.getValue());
                }
                log.debug("[{}] Cache set for argument(s) {}", name, entry.getValue().keySet());
            }
        });
        return this;
    }

    /**
     * @return 参数到值的映射；null 表示清除该资源的全部槽位
     */
    private Map<String, Object> toSlots(ResourceSpec spec, Object payload) {
        String name = spec.getName();
        if (payload == null) {
            return null;
        }

        List<?> list = null;
        if (payload instanceof Object[]) {
            list = Arrays.asList((Object[]) payload);
        } else if (payload instanceof List) {
            list = (List<?>) payload;
        }

        Map<String, Object> slots = new LinkedHashMap<>();
        if (list != null) {
            if (list.size() == 1) {
                slots.put(container.normalizeArgument(spec, null), list.get(0));
            } else if (list.size() % 2 == 0) {
                for (int i = 0; i < list.size(); i += 2) {
                    slots.put(container.normalizeArgument(spec, list.get(i)), list.get(i + 1));
                }
            } else {
                throw new InvalidCacheValueError(name,
                        "a list must hold a single value or argument/value pairs, got " + list.size() + " element(s)");
            }
        } else if (payload instanceof Map) {
            for (Map.Entry<?, ?> slot : ((Map<?, ?>) payload).entrySet()) {
                slots.put(container.normalizeArgument(spec, slot.getKey()), slot.getValue());
            }
        } else {
            throw new InvalidCacheValueError(name,
                    "value must be null, a list, or a map, not " + payload.getClass().getName());
        }
        return slots;
    }

    @Override
    public ContainerControl cleanCache() {
        container.runLocked(() -> {
            container.checkGeneration();
            int dropped = container.cache.size();
            container.cache.clear();
            log.debug("Dropped {} cached resource(s) without cleanup", dropped);
        });
        return this;
    }

    // ==================== 预加载 ====================

    @Override
    public ContainerControl preload() {
        container.getRegistry().selfCheck();
        List<String> names = container.getRegistry().preloadList();
        for (String name : names) {
            container.get(name);
        }
        log.info("Preloaded {} resource(s): {}", names.size(), names);
        return this;
    }

    // ==================== 销毁 ====================

    @Override
    public ContainerControl cleanup() {
        container.runLocked(() -> {
            if (container.tearingDown) {
                log.debug("Container teardown already done");
                return;
            }
            container.checkGeneration();
            container.tearingDown = true;

            List<String> order = container.evictionOrder(container.cache.names());
            log.info("Tearing down container, {} resource(s) in order: {}", order.size(), order);
            int failuresBefore = container.cleanupFailures.size();
            for (String name : order) {
                container.evict(name, false);
            }
            container.cache.clear();

            int failed = container.cleanupFailures.size() - failuresBefore;
            if (failed > 0) {
                log.warn("Container teardown finished with {} cleanup failure(s)", failed);
            } else {
                log.info("Container teardown complete");
            }
        });
        return this;
    }

    @Override
    public List<CleanupFailure> getCleanupFailures() {
        return container.withLock(() -> Collections.unmodifiableList(new ArrayList<>(container.cleanupFailures)));
    }
}
