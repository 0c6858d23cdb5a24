package com.silo.core.spi;

/**
 * 运行环境"代"探针 SPI
 * <p>
 * 容器在每次访问时比较当前代与上次记录的代，不一致即认为运行环境被复制过（如进程 fork），
 * 需要丢弃不可共享的缓存。返回值只用于相等比较。
 */
@FunctionalInterface
public interface GenerationProbe {

    /**
     * 当前代标识，须实现 equals
     */
    Object currentGeneration();

    /**
     * 永不变化的探针，关闭 fork 检测
     */
    static GenerationProbe none() {
        return () -> Boolean.TRUE;
    }
}
