package villagecompute.newsence.workflow;

import java.time.Duration;

/**
 * Waits between step retries. Tests substitute a recording no-op.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
