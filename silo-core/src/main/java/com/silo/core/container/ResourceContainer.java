package com.silo.core.container;

import com.silo.api.container.Silo;
import com.silo.api.container.SiloControl;
import com.silo.api.exception.ArgumentTypeError;
import com.silo.api.exception.ArgumentValidationError;
import com.silo.api.exception.CircularDependencyError;
import com.silo.api.exception.LockedModeError;
import com.silo.api.exception.ResourceInitError;
import com.silo.api.exception.TeardownInProgressError;
import com.silo.api.resource.CleanupFailure;
import com.silo.api.resource.ResourceCleanup;
import com.silo.api.resource.ResourceInitializer;
import com.silo.core.generation.ProcessGenerationProbe;
import com.silo.core.inject.ConstructorInjector;
import com.silo.core.registry.ResourceRef;
import com.silo.core.registry.ResourceRegistry;
import com.silo.core.spec.ResourceSpec;
import com.silo.core.spi.GenerationProbe;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 资源容器
 * <p>
 * 职责：按 (资源名, 参数) 懒加载并缓存资源、检测循环依赖、在运行环境被复制（fork）后
 * 丢弃不可共享的缓存、按 cleanup order 有序销毁。
 * <p>
 * 每个容器一把可重入锁，所有公开操作都在锁内执行；初始化函数在同一线程内回调容器是允许的。
 */
@Slf4j
public class ResourceContainer implements Silo {

    /**
     * 生成调用位置时跳过的内部类
     */
    private static final List<String> INTERNAL_CLASSES = List.of(
            ResourceContainer.class.getName(),
            ContainerControl.class.getName(),
            ResourceRef.class.getName(),
            ConstructorInjector.class.getName(),
            "com.silo.core.inject.Injection");

    private final ResourceRegistry registry;
    private final GenerationProbe generationProbe;
    private final ReentrantLock lock = new ReentrantLock();

    final ResourceCache cache = new ResourceCache();
    final Map<String, ResourceInitializer<Object>> overrides = new HashMap<>();
    final List<CleanupFailure> cleanupFailures = new ArrayList<>();

    // 当前调用链上正在解析的缓存键
    private final Set<String> pending = new HashSet<>();

    private Object generation;
    private boolean recovering;
    boolean locked;
    boolean tearingDown;

    public ResourceContainer(ResourceRegistry registry) {
        this(registry, null, new ProcessGenerationProbe());
    }

    public ResourceContainer(ResourceRegistry registry, Map<String, ?> initialOverrides) {
        this(registry, initialOverrides, new ProcessGenerationProbe());
    }

    public ResourceContainer(ResourceRegistry registry, Map<String, ?> initialOverrides,
                             GenerationProbe generationProbe) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.generationProbe = generationProbe != null ? generationProbe : GenerationProbe.none();
        this.generation = this.generationProbe.currentGeneration();

        if (initialOverrides != null && !initialOverrides.isEmpty()) {
            control().override(initialOverrides);
        }
    }

    // ==================== 资源访问 ====================

    @Override
    public Object get(String name) {
        return resolve(name, null, true);
    }

    @Override
    public Object get(String name, Object argument) {
        return resolve(name, argument, true);
    }

    @Override
    public Object fresh(String name) {
        return resolve(name, null, false);
    }

    @Override
    public Object fresh(String name, Object argument) {
        return resolve(name, argument, false);
    }

    @Override
    public Object cached(String name) {
        return cached(name, null);
    }

    @Override
    public Object cached(String name, Object argument) {
        return withLock(() -> {
            ResourceSpec spec = registry.require(name);
            String arg = normalizeArgument(spec, argument);
            checkGeneration();
            return cache.get(name, arg);
        });
    }

    @Override
    public SiloControl control() {
        return new ContainerControl(this);
    }

    @Override
    public void close() {
        control().cleanup();
    }

    public ResourceRegistry getRegistry() {
        return registry;
    }

    public ContainerStats getStats() {
        return withLock(() -> new ContainerStats(
                cache.size(), overrides.size(), locked, tearingDown, cleanupFailures.size()));
    }

    // ==================== 解析 ====================

    private Object resolve(String name, Object argument, boolean useCache) {
        lock.lock();
        try {
            ResourceSpec spec = registry.require(name);
            String arg = normalizeArgument(spec, argument);

            checkGeneration();

            boolean caching = useCache && !spec.isIgnoreCache();
            if (caching && cache.contains(name, arg)) {
                return cache.get(name, arg);
            }

            String key = keyOf(name, arg);
            if (pending.contains(key)) {
                List<String> loop = new ArrayList<>(pending);
                loop.sort(Comparator.naturalOrder());
                throw new CircularDependencyError(name, key, loop, callSite());
            }

            pending.add(key);
            try {
                if (locked && !spec.isDerived() && !overrides.containsKey(name)) {
                    throw new LockedModeError(name);
                }
                if (tearingDown) {
                    throw new TeardownInProgressError(name);
                }

                Object value = instantiate(spec, arg);
                if (caching) {
                    cache.put(name, arg, value);
                }
                return value;
            } finally {
                pending.remove(key);
            }
        } finally {
            lock.unlock();
        }
    }

    private Object instantiate(ResourceSpec spec, String arg) {
        String name = spec.getName();
        ResourceInitializer<Object> initializer = overrides.get(name);
        boolean overridden = initializer != null;
        if (!overridden) {
            initializer = spec.getInit();
            for (String className : spec.getRequires()) {
                ResourceRegistry.loadRequired(name, className);
            }
        }

        log.debug("[{}] Initializing{} (argument='{}')", name, overridden ? " override" : "", arg);
        try {
            Object value = initializer.init(this, name, arg);
            if (spec.getPostInit() != null) {
                value = spec.getPostInit().apply(value, this);
            }
            return value;
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ResourceInitError(name, arg, e);
        }
    }

    /**
     * 参数归一化：null 为空串，标量转字符串，再交给声明的校验器
     */
    String normalizeArgument(ResourceSpec spec, Object argument) {
        String arg = toArgumentString(spec.getName(), argument);
        if (!spec.getArgumentValidator().accept(arg)) {
            throw new ArgumentValidationError(spec.getName(), arg);
        }
        return arg;
    }

    private static String toArgumentString(String name, Object argument) {
        if (argument == null) {
            return "";
        }
        if (argument instanceof CharSequence || argument instanceof Number || argument instanceof Boolean
                || argument instanceof Character || argument instanceof Enum) {
            return String.valueOf(argument);
        }
        throw new ArgumentTypeError(name, argument);
    }

    static String keyOf(String name, String arg) {
        return arg.isEmpty() ? name : name + "@" + arg;
    }

    private static String callSite() {
        return StackWalker.getInstance().walk(frames -> frames
                .filter(frame -> INTERNAL_CLASSES.stream().noneMatch(
                        internal -> frame.getClassName().equals(internal)
                                || frame.getClassName().startsWith(internal + "$")))
                .findFirst()
                .map(frame -> frame.getClassName() + "." + frame.getMethodName()
                        + "(" + frame.getFileName() + ":" + frame.getLineNumber() + ")")
                .orElse(null));
    }

    // ==================== fork 恢复 ====================

    /**
     * 发现代变化时执行一次 fork 恢复：fork_safe 的条目原样保留，
     * 其余条目调用 fork_cleanup（没有则 cleanup）后移除。覆盖与锁定状态不受影响。
     */
    void checkGeneration() {
        if (recovering) {
            return;
        }
        Object current = generationProbe.currentGeneration();
        if (Objects.equals(current, generation)) {
            return;
        }

        recovering = true;
        try {
            List<String> unsafe = new ArrayList<>();
            for (String name : evictionOrder(cache.names())) {
                boolean forkSafe = registry.lookup(name).map(ResourceSpec::isForkSafe).orElse(false);
                if (!forkSafe) {
                    unsafe.add(name);
                }
            }
            log.info("Generation change detected ({} -> {}), evicting {} resource(s): {}",
                    generation, current, unsafe.size(), unsafe);
            for (String name : unsafe) {
                evict(name, true);
            }
            generation = current;
        } finally {
            recovering = false;
        }
    }

    // ==================== 驱逐 ====================

    /**
     * 移除资源的全部缓存槽位并调用对应的清理函数
     * <p>
     * 清理失败只记录，不中断其余槽位
     *
     * @param forked 是否因 fork 驱逐
     */
    void evict(String name, boolean forked) {
        Map<String, Object> slots = cache.remove(name);
        if (slots.isEmpty()) {
            return;
        }

        ResourceSpec spec = registry.lookup(name).orElse(null);
        ResourceCleanup<Object> cleanup = null;
        if (spec != null) {
            cleanup = forked && spec.getForkCleanup() != null ? spec.getForkCleanup() : spec.getCleanup();
        }
        if (cleanup == null) {
            log.debug("[{}] Evicted {} cached instance(s) without cleanup", name, slots.size());
            return;
        }

        for (Map.Entry<String, Object> slot : slots.entrySet()) {
            try {
                cleanup.cleanup(slot.getValue());
                log.debug("[{}] Cleaned up instance (argument='{}', forked={})", name, slot.getKey(), forked);
            } catch (Exception e) {
                log.error("[{}] Failed to clean up instance (argument='{}', forked={})",
                        name, slot.getKey(), forked, e);
                cleanupFailures.add(new CleanupFailure(name, slot.getKey(), forked, e));
            }
        }
    }

    /**
     * 按 cleanup order 升序排列，相同时按注册顺序
     */
    List<String> evictionOrder(Collection<String> names) {
        List<String> ordered = new ArrayList<>(names);
        ordered.sort(Comparator
                .comparingDouble((String name) -> registry.lookup(name).map(ResourceSpec::getCleanupOrder).orElse(0.0))
                .thenComparingInt(registry::positionOf));
        return ordered;
    }

    // ==================== 锁 ====================

    <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    void runLocked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "ResourceContainer{resources=" + registry.size() + ", " + getStats() + "}";
    }
}
