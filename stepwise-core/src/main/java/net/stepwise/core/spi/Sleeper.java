package net.stepwise.core.spi;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    Sleeper SYSTEM = d -> {
        if (!d.isZero() && !d.isNegative()) Thread.sleep(d.toMillis());
    };
}
