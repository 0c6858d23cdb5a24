package com.silo.core.registry;

import com.silo.api.container.Silo;
import lombok.Getter;
import lombok.NonNull;

/**
 * 类型化的资源访问入口
 * <p>
 * 在注册期解析一次，之后通过任意容器取值：{@code DB.get(silo)}
 *
 * @param <T> 资源类型
 */
@Getter
public final class ResourceRef<T> {

    private final String name;
    private final Class<T> type;

    ResourceRef(String name, Class<T> type) {
        this.name = name;
        this.type = type;
    }

    public T get(Silo silo) {
        return type.cast(silo.get(name));
    }

    public T get(Silo silo, Object argument) {
        return type.cast(silo.get(name, argument));
    }

    public T fresh(Silo silo) {
        return type.cast(silo.fresh(name));
    }

    public T fresh(Silo silo, Object argument) {
        return type.cast(silo.fresh(name, argument));
    }

    /**
     * 只读查询缓存
     *
     * @return 缓存值，不存在时返回 null
     */
    public T cached(Silo silo) {
        return type.cast(silo.cached(name));
    }

    @Override
    @NonNull
    public String toString() {
        return "ResourceRef{" + name + ": " + type.getSimpleName() + "}";
    }
}
