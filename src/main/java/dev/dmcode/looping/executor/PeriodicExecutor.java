package dev.dmcode.looping.executor;

import java.time.Duration;

public interface PeriodicExecutor extends AutoCloseable {

    /**
     * Stops invoking the routine. Returns once the worker has stopped, after any invocation in
     * progress has completed.
     *
     * @param resetTime if {@code true}, the next invocation after {@link #resume()} happens one
     *                  period after resuming; otherwise the wait time remaining at pause is kept
     * @throws IllegalStateException if already paused or closed
     */
    void pause(boolean resetTime);

    default void pause() {
        pause(true);
    }

    /**
     * @throws IllegalStateException if not paused
     */
    void resume();

    /**
     * Applies from the next scheduled invocation; the wait already in progress is not changed.
     */
    void setPeriod(Duration period);

    void setCatchUp(boolean catchUp);

    void setErrorCallback(ErrorCallback errorCallback);

    LoopingThreadState state();

    /**
     * Stops the worker and waits for it to terminate. Calling it again has no effect.
     */
    @Override
    void close();
}
