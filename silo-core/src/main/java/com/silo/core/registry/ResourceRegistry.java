package com.silo.core.registry;

import com.silo.api.container.Silo;
import com.silo.api.exception.DuplicateResourceError;
import com.silo.api.exception.MissingDependencyError;
import com.silo.api.exception.ReservedNameError;
import com.silo.api.exception.UnknownResourceError;
import com.silo.api.exception.UnloadableDependencyError;
import com.silo.core.spec.ResourceOptions;
import com.silo.core.spec.ResourceSpec;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 资源注册表
 * <p>
 * 按注册顺序保存资源声明。声明一经注册不可替换，预加载列表只追加。
 * 一个注册表可以被多个容器共享。
 */
@Slf4j
public class ResourceRegistry {

    /**
     * 容器自身的操作名，资源不能占用
     */
    private static final Set<String> RESERVED_NAMES = reservedNames();

    private final Map<String, ResourceSpec> specs = new LinkedHashMap<>();
    private final Map<String, Integer> positions = new LinkedHashMap<>();
    private final List<String> preload = new CopyOnWriteArrayList<>();

    // ==================== 注册 ====================

    /**
     * 注册资源声明
     *
     * @throws DuplicateResourceError 同名资源已存在
     * @throws ReservedNameError      名称与容器操作冲突
     */
    public synchronized ResourceRegistry register(ResourceSpec spec) {
        String name = spec.getName();
        if (specs.containsKey(name)) {
            throw new DuplicateResourceError(name);
        }
        if (RESERVED_NAMES.contains(name)) {
            throw new ReservedNameError(name);
        }

        positions.put(name, specs.size());
        specs.put(name, spec);
        if (spec.isPreload()) {
            preload.add(name);
        }

        log.debug("[{}] Resource registered: {}", name, spec);
        return this;
    }

    /**
     * 以选项表形式注册，见 {@link ResourceOptions}
     */
    public ResourceRegistry register(String name, Map<String, ?> options) {
        // 先做命名冲突检查，报错信息优先于选项校验
        checkName(name);
        return register(ResourceOptions.parse(name, options));
    }

    // ==================== 查询 ====================

    public synchronized Optional<ResourceSpec> lookup(String name) {
        return Optional.ofNullable(specs.get(name));
    }

    /**
     * 获取资源声明，不存在时抛出 {@link UnknownResourceError}
     */
    public ResourceSpec require(String name) {
        return lookup(name).orElseThrow(() -> new UnknownResourceError(name));
    }

    public synchronized boolean contains(String name) {
        return specs.containsKey(name);
    }

    /**
     * 注册顺序，未注册时返回 -1
     */
    public synchronized int positionOf(String name) {
        Integer position = positions.get(name);
        return position == null ? -1 : position;
    }

    /**
     * 所有资源名（注册顺序）
     */
    public synchronized List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(specs.keySet()));
    }

    /**
     * 标记了 preload 的资源名（注册顺序）
     */
    public List<String> preloadList() {
        return Collections.unmodifiableList(new ArrayList<>(preload));
    }

    public synchronized int size() {
        return specs.size();
    }

    /**
     * 创建类型化访问入口，资源名在此刻校验而不是每次访问时
     */
    public <T> ResourceRef<T> ref(String name, Class<T> type) {
        require(name);
        return new ResourceRef<>(name, type);
    }

    // ==================== 自检 ====================

    /**
     * 校验所有声明的依赖已注册、require 的类可加载
     *
     * @throws MissingDependencyError     依赖未注册，或非 loose_deps 时依赖注册在自身之后
     * @throws UnloadableDependencyError  require 的类无法加载
     */
    public void selfCheck() {
        List<ResourceSpec> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(specs.values());
        }

        for (ResourceSpec spec : snapshot) {
            String name = spec.getName();
            if (spec.getDependencies() != null) {
                for (String dependency : spec.getDependencies()) {
                    int position = positionOf(dependency);
                    if (position < 0) {
                        throw new MissingDependencyError(name, dependency,
                                "dependency '" + dependency + "' is not a registered resource");
                    }
                    if (!spec.isLooseDeps() && position > positionOf(name)) {
                        throw new MissingDependencyError(name, dependency,
                                "dependency '" + dependency + "' must be declared before '" + name
                                        + "' (or set loose_deps)");
                    }
                }
            }

            for (String className : spec.getRequires()) {
                loadRequired(name, className);
            }
        }

        log.info("Self-check passed for {} resource(s)", snapshot.size());
    }

    /**
     * 加载 require 声明的类
     */
    public static Class<?> loadRequired(String resourceName, String className) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = ResourceRegistry.class.getClassLoader();
        }
        try {
            return Class.forName(className, true, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new UnloadableDependencyError(resourceName, className, e);
        }
    }

    private synchronized void checkName(String name) {
        if (name != null && specs.containsKey(name)) {
            throw new DuplicateResourceError(name);
        }
        if (name != null && RESERVED_NAMES.contains(name)) {
            throw new ReservedNameError(name);
        }
    }

    private static Set<String> reservedNames() {
        Set<String> names = new HashSet<>();
        for (Method method : Silo.class.getMethods()) {
            names.add(method.getName());
        }
        names.add("ctl");
        return Collections.unmodifiableSet(names);
    }
}
