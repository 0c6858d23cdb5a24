package com.silo.core.util;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * YAML 工具类
 * <p>
 * 配置文件只含标量、列表与映射，统一使用 SafeConstructor，拒绝 {@code !!} 全局标签。
 */
public class SiloYaml {

    private static final int MAX_ALIASES = 50;

    private SiloYaml() {
    }

    /**
     * 创建仅用于加载的 Yaml 实例
     */
    public static Yaml createLoaderYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setAllowDuplicateKeys(false);
        loaderOptions.setMaxAliasesForCollections(MAX_ALIASES);
        return new Yaml(new SafeConstructor(loaderOptions));
    }
}
