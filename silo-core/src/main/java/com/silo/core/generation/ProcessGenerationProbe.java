package com.silo.core.generation;

import com.silo.core.spi.GenerationProbe;

/**
 * 以当前进程 PID 为代标识
 */
public class ProcessGenerationProbe implements GenerationProbe {

    @Override
    public Object currentGeneration() {
        return ProcessHandle.current().pid();
    }
}
