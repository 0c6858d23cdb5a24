package com.silo.core.inject;

import com.silo.api.container.Silo;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * 构造函数参数的来源：资源、带参数的资源或字面量
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Injection {

    String resourceName;
    String argument;
    Object literal;

    /**
     * 注入无参数资源
     */
    public static Injection resource(String name) {
        return new Injection(name, null, null);
    }

    /**
     * 注入带参数的资源
     */
    public static Injection resource(String name, String argument) {
        return new Injection(name, argument, null);
    }

    /**
     * 原样注入字面量
     */
    public static Injection literal(Object value) {
        return new Injection(null, null, value);
    }

    public boolean isLiteral() {
        return resourceName == null;
    }

    Object resolve(Silo silo) {
        if (isLiteral()) {
            return literal;
        }
        return silo.get(resourceName, argument);
    }

    @Override
    @NonNull
    public String toString() {
        if (isLiteral()) {
            return "literal(" + literal + ")";
        }
        return argument == null ? resourceName : resourceName + "@" + argument;
    }
}
