package com.silo.core.config;

import com.silo.core.generation.ProcessGenerationProbe;
import com.silo.core.spi.GenerationProbe;

/**
 * fork 检测策略
 */
public enum ForkDetection {

    /**
     * 按进程 PID 检测
     */
    PROCESS {
        @Override
        public GenerationProbe createProbe() {
            return new ProcessGenerationProbe();
        }
    },

    /**
     * 不检测
     */
    NONE {
        @Override
        public GenerationProbe createProbe() {
            return GenerationProbe.none();
        }
    };

    public abstract GenerationProbe createProbe();
}
