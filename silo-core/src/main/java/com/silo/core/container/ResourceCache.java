package com.silo.core.container;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 两级缓存：资源名 -> (参数 -> 实例)
 * <p>
 * 非线程安全，由所属容器的锁保护。槽位保持写入顺序，空的资源条目会被立即移除。
 */
class ResourceCache {

    private final Map<String, Map<String, Object>> entries = new LinkedHashMap<>();

    boolean contains(String name, String argument) {
        Map<String, Object> slots = entries.get(name);
        return slots != null && slots.containsKey(argument);
    }

    Object get(String name, String argument) {
        Map<String, Object> slots = entries.get(name);
        return slots == null ? null : slots.get(argument);
    }

    void put(String name, String argument, Object value) {
        entries.computeIfAbsent(name, k -> new LinkedHashMap<>()).put(argument, value);
    }

    /**
     * 移除资源的全部槽位
     *
     * @return 被移除的槽位，没有时返回空 Map
     */
    Map<String, Object> remove(String name) {
        Map<String, Object> slots = entries.remove(name);
        return slots == null ? Collections.emptyMap() : slots;
    }

    /**
     * 当前有缓存的资源名
     */
    List<String> names() {
        return new ArrayList<>(entries.keySet());
    }

    int size() {
        int count = 0;
        for (Map<String, Object> slots : entries.values()) {
            count += slots.size();
        }
        return count;
    }

    void clear() {
        entries.clear();
    }
}
