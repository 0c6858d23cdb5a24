package com.silo.core.inject;

import com.silo.api.exception.ResourceInitError;
import com.silo.core.container.ResourceContainer;
import com.silo.core.registry.ResourceRegistry;
import com.silo.core.spec.ResourceSpec;
import com.silo.core.spi.GenerationProbe;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConstructorInjector 单元测试")
class ConstructorInjectorTest {

    public static class Repository {
        private final String url;
        private final String schema;
        private final int poolSize;

        public Repository(String url, String schema, int poolSize) {
            this.url = url;
            this.schema = schema;
            this.poolSize = poolSize;
        }
    }

    public static class Failing {
        public Failing() throws java.io.IOException {
            throw new java.io.IOException("disk unavailable");
        }
    }

    private ResourceRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ResourceRegistry()
                .register(ResourceSpec.builder("url").literal("jdbc:h2:mem").build())
                .register(ResourceSpec.builder("schema")
                        .init((silo, name, arg) -> "schema_" + arg)
                        .argument(arg -> !arg.isEmpty())
                        .build());
    }

    private ResourceContainer container() {
        return new ResourceContainer(registry, null, GenerationProbe.none());
    }

    @Test
    @DisplayName("按声明顺序注入资源、带参数资源与字面量")
    void shouldInjectInOrder() {
        registry.register(ResourceSpec.builder("repository")
                .type(Repository.class)
                .inject("url", Injection.resource("url"))
                .inject("schema", Injection.resource("schema", "tenant"))
                .inject("poolSize", Injection.literal(8))
                .build());
        ResourceContainer container = container();

        Repository repository = (Repository) container.get("repository");

        assertEquals("jdbc:h2:mem", repository.url);
        assertEquals("schema_tenant", repository.schema);
        assertEquals(8, repository.poolSize);
        assertSame(repository, container.get("repository"));
        assertEquals("schema_tenant", container.cached("schema", "tenant"));
    }

    @Test
    @DisplayName("没有匹配的构造函数")
    void shouldFailWithoutMatchingConstructor() {
        registry.register(ResourceSpec.builder("repository")
                .type(Repository.class)
                .inject("url", Injection.resource("url"))
                .build());

        ResourceInitError error = assertThrows(ResourceInitError.class, () -> container().get("repository"));

        assertInstanceOf(NoSuchMethodException.class, error.getCause());
    }

    @Test
    @DisplayName("构造函数抛出的受检异常被解包后包装")
    void shouldUnwrapConstructorException() {
        registry.register(ResourceSpec.builder("failing").type(Failing.class).build());

        ResourceInitError error = assertThrows(ResourceInitError.class, () -> container().get("failing"));

        assertInstanceOf(java.io.IOException.class, error.getCause());
        assertEquals("disk unavailable", error.getCause().getMessage());
    }

    @Test
    @DisplayName("抽象类型无法构造")
    void shouldRejectAbstractType() {
        ConstructorInjector<Runnable> injector = new ConstructorInjector<>(Runnable.class, Map.of());

        assertThrows(InstantiationException.class, () -> injector.init(container(), "task", ""));
    }
}
