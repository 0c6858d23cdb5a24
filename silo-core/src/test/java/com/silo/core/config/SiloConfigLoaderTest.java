package com.silo.core.config;

import com.silo.api.exception.SiloException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SiloConfigLoader 单元测试")
class SiloConfigLoaderTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("从 classpath 资源加载带根节点的配置")
    void shouldLoadNestedConfig() {
        InputStream is = getClass().getClassLoader().getResourceAsStream("config/silo-custom.yml");
        assertNotNull(is);

        SiloConfig config = SiloConfigLoader.load(is, "silo-custom.yml");

        assertEquals(ForkDetection.NONE, config.getForkDetection());
        assertFalse(config.isPreloadOnStart());
        assertTrue(config.isLockAfterPreload());
        assertFalse(config.isRegisterShutdownHook());
        assertTrue(config.isSelfCheckOnStart());
    }

    @Test
    @DisplayName("平铺写法与文件路径")
    void shouldLoadFlatConfigFromPath(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("silo.yml");
        Files.writeString(file, "fork-detection: Process\nself-check-on-start: false\n");

        SiloConfig config = SiloConfigLoader.load(file);

        assertEquals(ForkDetection.PROCESS, config.getForkDetection());
        assertFalse(config.isSelfCheckOnStart());
    }

    @Test
    @DisplayName("空文档返回默认配置")
    void emptyDocumentShouldUseDefaults() {
        SiloConfig config = SiloConfigLoader.load(yaml(""), "empty");

        assertEquals(SiloConfig.defaults().toString(), config.toString());
    }

    @Test
    @DisplayName("未知键被忽略")
    void unknownKeysShouldBeIgnored() {
        SiloConfig config = SiloConfigLoader.fromMap(Map.of("colour", "blue", "lock-after-preload", true), "test");

        assertTrue(config.isLockAfterPreload());
    }

    @Test
    @DisplayName("非法取值")
    void invalidValuesShouldFail() {
        assertThrows(SiloException.class, () -> SiloConfigLoader.load(yaml("fork-detection: sometimes"), "bad"));
        assertThrows(SiloException.class, () -> SiloConfigLoader.load(yaml("preload-on-start: maybe"), "bad"));
        assertThrows(SiloException.class, () -> SiloConfigLoader.load(yaml("- a\n- b\n"), "bad"));
        assertThrows(SiloException.class, () -> SiloConfigLoader.load(yaml("a: 1\na: 2\n"), "bad"));
    }

    @Test
    @DisplayName("文件不存在")
    void missingFileShouldFail(@TempDir Path dir) {
        SiloException error = assertThrows(SiloException.class,
                () -> SiloConfigLoader.load(dir.resolve("absent.yml")));
        assertNull(error.getResourceName());
    }
}
