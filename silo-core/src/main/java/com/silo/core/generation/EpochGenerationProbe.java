package com.silo.core.generation;

import com.silo.core.spi.GenerationProbe;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 显式计数的代标识
 * <p>
 * 由宿主在复制运行环境（快照恢复、子进程接管等）后调用 {@link #advance()}，
 * 也用于在测试中模拟 fork。
 */
@Slf4j
public class EpochGenerationProbe implements GenerationProbe {

    private final AtomicLong epoch = new AtomicLong();

    @Override
    public Object currentGeneration() {
        return epoch.get();
    }

    /**
     * 进入新的一代
     *
     * @return 新的代号
     */
    public long advance() {
        long next = epoch.incrementAndGet();
        log.debug("Generation advanced to {}", next);
        return next;
    }
}
