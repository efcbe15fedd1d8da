package com.di.bidshub.upload.stage;

import java.time.Duration;

/** Backoff wait; replaced in tests so retries run instantly. */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return d -> Thread.sleep(d.toMillis());
    }
}
