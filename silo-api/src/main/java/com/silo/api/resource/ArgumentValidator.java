package com.silo.api.resource;

import java.util.regex.Pattern;

/**
 * 资源参数校验
 */
@FunctionalInterface
public interface ArgumentValidator {

    /**
     * 默认校验：只接受空串，即"无参数"
     */
    ArgumentValidator NO_ARGUMENT = String::isEmpty;

    boolean accept(String argument);

    /**
     * 基于正则的校验，总是匹配整个字符串
     */
    static ArgumentValidator matching(Pattern pattern) {
        return argument -> pattern.matcher(argument).matches();
    }

    static ArgumentValidator matching(String regex) {
        return matching(Pattern.compile(regex));
    }
}
