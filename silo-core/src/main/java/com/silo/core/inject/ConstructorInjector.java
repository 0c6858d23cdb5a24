package com.silo.core.inject;

import com.silo.api.container.Silo;
import com.silo.api.resource.ResourceInitializer;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 构造函数注入
 * <p>
 * 依次解析声明的注入项（经由 {@link Silo#get}），再按位置传给第一个参数个数与类型都匹配的
 * public 构造函数。只是 get 之上的一层薄封装，不参与缓存与生命周期。
 */
@Slf4j
public class ConstructorInjector<T> implements ResourceInitializer<T> {

    private final Class<T> type;
    private final Map<String, Injection> injections;

    public ConstructorInjector(Class<T> type, Map<String, Injection> injections) {
        this.type = type;
        this.injections = Collections.unmodifiableMap(new LinkedHashMap<>(injections));
    }

    @Override
    public T init(Silo silo, String name, String argument) throws Exception {
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new InstantiationException("Cannot instantiate abstract type " + type.getName());
        }

        List<Object> values = new ArrayList<>(injections.size());
        for (Injection injection : injections.values()) {
            values.add(injection.resolve(silo));
        }
        Object[] args = values.toArray();

        Constructor<?> constructor = findConstructor(args);
        log.debug("[{}] Constructing {} with {}", name, type.getName(), injections.keySet());
        try {
            return type.cast(constructor.newInstance(args));
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw e;
        }
    }

    private Constructor<?> findConstructor(Object[] args) throws NoSuchMethodException {
        for (Constructor<?> constructor : type.getConstructors()) {
            if (matches(constructor.getParameterTypes(), args)) {
                return constructor;
            }
        }
        throw new NoSuchMethodException("No public constructor of " + type.getName()
                + " accepts parameters " + injections.keySet());
    }

    private static boolean matches(Class<?>[] parameterTypes, Object[] args) {
        if (parameterTypes.length != args.length) {
            return false;
        }
        for (int i = 0; i < args.length; i++) {
            Class<?> parameterType = wrap(parameterTypes[i]);
            if (args[i] == null) {
                if (parameterTypes[i].isPrimitive()) {
                    return false;
                }
            } else if (!parameterType.isInstance(args[i])) {
                return false;
            }
        }
        return true;
    }

    private static Class<?> wrap(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == double.class) return Double.class;
        if (type == boolean.class) return Boolean.class;
        if (type == float.class) return Float.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        if (type == char.class) return Character.class;
        return Void.class;
    }
}
