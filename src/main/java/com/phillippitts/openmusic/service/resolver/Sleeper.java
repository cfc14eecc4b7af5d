package com.phillippitts.openmusic.service.resolver;

import java.time.Duration;

/**
 * Blocking pause between retries; replaced in tests to keep them fast.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
