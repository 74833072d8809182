package dev.dmcode.looping.executor;

import dev.dmcode.looping.latch.DeadlineLatch;
import dev.dmcode.looping.latch.WaitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

public class LoopingThread implements PeriodicExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoopingThread.class);

    private final Lock lock = new ReentrantLock();
    private final DeadlineLatch wakeup = new DeadlineLatch();
    private final DeadlineLatch resumed = new DeadlineLatch();
    private final DeadlineLatch pauseAcknowledged = new DeadlineLatch();

    private final Routine routine;
    private final AtomicReference<LoopingThreadSettings> settings;
    private final Thread thread;

    private volatile LoopingThreadState state;
    private boolean resetTimeOnResume;
    private boolean closed;

    public LoopingThread() {
        this(LoopingThreadConfiguration.defaults(), null);
    }

    public LoopingThread(Duration period, Routine routine) {
        this(period, routine, true);
    }

    public LoopingThread(Duration period, Routine routine, boolean startRunning) {
        this(
            LoopingThreadConfiguration.defaults()
                .withPeriod(period)
                .withStartRunning(startRunning),
            routine
        );
    }

    public LoopingThread(LoopingThreadConfiguration configuration, Routine routine) {
        Objects.requireNonNull(configuration, "Looping thread configuration must be provided");
        this.routine = routine;
        this.settings = new AtomicReference<>(LoopingThreadSettings.of(configuration));
        if (routine == null) {
            this.state = LoopingThreadState.EMPTY;
            this.thread = null;
            return;
        }
        this.state = configuration.startRunning() ? LoopingThreadState.RUNNING : LoopingThreadState.PAUSED;
        this.thread = new Thread(this::run, configuration.threadName());
        this.thread.start();
        LOGGER.debug("Looping thread {} started in state {}", thread.getName(), state);
    }

    @Override
    public void pause(boolean resetTime) {
        if (routine == null) {
            return;
        }
        requireOwnerThread("pause");
        lock.lock();
        try {
            if (state == LoopingThreadState.PAUSED) {
                throw new IllegalStateException("Looping thread is already paused");
            }
            if (state != LoopingThreadState.RUNNING) {
                throw new IllegalStateException("Looping thread is not running: " + state);
            }
            pauseAcknowledged.rearm();
            state = LoopingThreadState.PAUSED;
            resetTimeOnResume = resetTime;
        } finally {
            lock.unlock();
        }
        wakeup.release();
        pauseAcknowledged.awaitUninterruptibly();
        LOGGER.debug("Looping thread {} paused", thread.getName());
    }

    @Override
    public void resume() {
        if (routine == null) {
            return;
        }
        requireOwnerThread("resume");
        lock.lock();
        try {
            if (state != LoopingThreadState.PAUSED) {
                throw new IllegalStateException("Looping thread is not paused: " + state);
            }
            state = LoopingThreadState.RUNNING;
        } finally {
            lock.unlock();
        }
        resumed.release();
        LOGGER.debug("Looping thread {} resumed", thread.getName());
    }

    @Override
    public void setPeriod(Duration period) {
        if (routine == null) {
            return;
        }
        LoopingThreadConfiguration.requireValidPeriod(period);
        settings.updateAndGet(current -> current.withPeriod(period));
    }

    @Override
    public void setCatchUp(boolean catchUp) {
        if (routine == null) {
            return;
        }
        settings.updateAndGet(current -> current.withCatchUp(catchUp));
    }

    @Override
    public void setErrorCallback(ErrorCallback errorCallback) {
        if (routine == null) {
            return;
        }
        Objects.requireNonNull(errorCallback, "Error callback must be provided");
        settings.updateAndGet(current -> current.withErrorCallback(errorCallback));
    }

    @Override
    public LoopingThreadState state() {
        return state;
    }

    @Override
    public void close() {
        if (routine == null) {
            return;
        }
        requireOwnerThread("close");
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            if (state != LoopingThreadState.TERMINATED) {
                state = LoopingThreadState.EXITING;
            }
        } finally {
            lock.unlock();
        }
        wakeup.release();
        resumed.release();
        joinUninterruptibly();
        LOGGER.debug("Looping thread {} terminated", thread.getName());
    }

    private void run() {
        long nextDeadline = System.nanoTime();
        long pausedAt = nextDeadline;
        boolean parked = false;
        try {
            while (true) {
                var currentState = state;
                if (currentState == LoopingThreadState.EXITING) {
                    break;
                }
                if (currentState == LoopingThreadState.PAUSED) {
                    if (!parked) {
                        parked = true;
                        pausedAt = System.nanoTime();
                    }
                    park();
                    continue;
                }
                if (parked) {
                    parked = false;
                    nextDeadline = resumedDeadline(nextDeadline, pausedAt);
                }
                if (wakeup.awaitUntil(nextDeadline) == WaitResult.SIGNALED) {
                    wakeup.rearm();
                    continue;
                }
                if (state != LoopingThreadState.RUNNING) {
                    continue;
                }
                var cycleSettings = settings.get();
                invokeRoutine(cycleSettings.errorCallback());
                nextDeadline = cycleSettings.catchUp()
                    ? nextDeadline + cycleSettings.periodNanos()
                    : System.nanoTime() + cycleSettings.periodNanos();
            }
        } catch (InterruptedException exception) {
            LOGGER.warn("Looping thread {} interrupted, terminating", Thread.currentThread().getName(), exception);
        } finally {
            terminate();
        }
    }

    private void terminate() {
        lock.lock();
        try {
            state = LoopingThreadState.TERMINATED;
            pauseAcknowledged.release();
        } finally {
            lock.unlock();
        }
    }

    private void park() throws InterruptedException {
        pauseAcknowledged.release();
        resumed.await();
        resumed.rearm();
    }

    private long resumedDeadline(long nextDeadline, long pausedAt) {
        boolean resetTime;
        lock.lock();
        try {
            resetTime = resetTimeOnResume;
        } finally {
            lock.unlock();
        }
        long now = System.nanoTime();
        return resetTime
            ? now + settings.get().periodNanos()
            : nextDeadline + (now - pausedAt);
    }

    private void invokeRoutine(ErrorCallback errorCallback) {
        try {
            routine.run();
        } catch (Exception exception) {
            notifyError(errorCallback, exception);
        } catch (Throwable throwable) {
            notifyError(errorCallback, new UnknownRoutineFailureException(throwable));
        }
        if (Thread.interrupted()) {
            LOGGER.debug("Interrupt raised by the routine cleared");
        }
    }

    private static void notifyError(ErrorCallback errorCallback, Exception exception) {
        try {
            errorCallback.onError(exception);
        } catch (Throwable callbackFailure) {
            if (callbackFailure != exception) {
                callbackFailure.addSuppressed(exception);
            }
            LOGGER.error("Error callback exception", callbackFailure);
        }
    }

    private void requireOwnerThread(String operation) {
        if (Thread.currentThread() == thread) {
            throw new IllegalStateException("Operation '" + operation + "' must not be called from the routine");
        }
    }

    private void joinUninterruptibly() {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    thread.join();
                    return;
                } catch (InterruptedException exception) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
