package com.silo.core.config;

import com.silo.api.exception.SiloException;
import com.silo.core.util.SiloYaml;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * 从 silo.yml 加载 {@link SiloConfig}
 * <p>
 * 支持根节点为 {@code silo:} 或直接平铺的写法，键名使用 kebab-case：
 * <pre>
 * silo:
 *   fork-detection: process
 *   self-check-on-start: true
 *   preload-on-start: true
 *   lock-after-preload: false
 *   register-shutdown-hook: true
 * </pre>
 */
@Slf4j
public class SiloConfigLoader {

    public static final String CONFIG_NAME = "silo.yml";
    private static final String ROOT_KEY = "silo";

    private SiloConfigLoader() {
    }

    /**
     * 从 classpath 加载 silo.yml，不存在时返回默认配置
     */
    public static SiloConfig load() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = SiloConfigLoader.class.getClassLoader();
        }
        InputStream is = loader.getResourceAsStream(CONFIG_NAME);
        if (is == null) {
            log.debug("No {} on classpath, using defaults", CONFIG_NAME);
            return SiloConfig.defaults();
        }
        return load(is, "classpath:" + CONFIG_NAME);
    }

    public static SiloConfig load(Path path) {
        try {
            return load(Files.newInputStream(path), path.toString());
        } catch (IOException e) {
            throw new SiloException(null, "Failed to read configuration " + path, e);
        }
    }

    public static SiloConfig load(InputStream inputStream, String source) {
        Yaml yaml = SiloYaml.createLoaderYaml();

        Object document;
        try (InputStream is = inputStream) {
            document = yaml.load(is);
        } catch (IOException | YAMLException e) {
            throw new SiloException(null, "Failed to load YAML configuration " + source, e);
        }

        if (document == null) {
            return SiloConfig.defaults();
        }
        if (!(document instanceof Map)) {
            throw new SiloException(null, "Configuration " + source + " must be a mapping");
        }

        Map<?, ?> root = (Map<?, ?>) document;
        Object nested = root.get(ROOT_KEY);
        if (nested instanceof Map) {
            root = (Map<?, ?>) nested;
        }

        SiloConfig config = fromMap(root, source);
        log.info("Loaded {} from {}", config, source);
        return config;
    }

    static SiloConfig fromMap(Map<?, ?> values, String source) {
        SiloConfig.SiloConfigBuilder builder = SiloConfig.builder();
        for (Map.Entry<?, ?> entry : values.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            switch (key) {
                case "fork-detection":
                    builder.forkDetection(toForkDetection(value, source));
                    break;
                case "self-check-on-start":
                    builder.selfCheckOnStart(toFlag(key, value, source));
                    break;
                case "preload-on-start":
                    builder.preloadOnStart(toFlag(key, value, source));
                    break;
                case "lock-after-preload":
                    builder.lockAfterPreload(toFlag(key, value, source));
                    break;
                case "register-shutdown-hook":
                    builder.registerShutdownHook(toFlag(key, value, source));
                    break;
                default:
                    log.warn("Ignoring unknown configuration key '{}' in {}", key, source);
            }
        }
        return builder.build();
    }

    private static ForkDetection toForkDetection(Object value, String source) {
        try {
            return ForkDetection.valueOf(String.valueOf(value).trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new SiloException(null, "Invalid fork-detection '" + value + "' in " + source, e);
        }
    }

    private static boolean toFlag(String key, Object value, String source) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new SiloException(null, "Configuration key '" + key + "' in " + source + " must be a boolean");
    }
}
