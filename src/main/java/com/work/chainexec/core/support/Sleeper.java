package com.work.chainexec.core.support;

import java.time.Duration;

/**
 * 退避 / 轮询等待的统一入口，便于测试替换为不真正睡眠的实现。
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return d -> {
            long ms = d == null ? 0L : d.toMillis();
            if (ms > 0) {
                Thread.sleep(ms);
            }
        };
    }
}
