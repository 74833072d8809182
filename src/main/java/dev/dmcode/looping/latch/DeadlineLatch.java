package dev.dmcode.looping.latch;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

public final class DeadlineLatch {

    private final Lock lock = new ReentrantLock();
    private final Condition releasedCondition = lock.newCondition();

    private boolean released;

    public WaitResult awaitUntil(long deadlineNanos) throws InterruptedException {
        lock.lock();
        try {
            long remainingNanos = deadlineNanos - System.nanoTime();
            while (!released && remainingNanos > 0) {
                remainingNanos = releasedCondition.awaitNanos(remainingNanos);
            }
            return released ? WaitResult.SIGNALED : WaitResult.TIMED_OUT;
        } finally {
            lock.unlock();
        }
    }

    public void await() throws InterruptedException {
        lock.lock();
        try {
            while (!released) {
                releasedCondition.await();
            }
        } finally {
            lock.unlock();
        }
    }

    public void awaitUninterruptibly() {
        lock.lock();
        try {
            while (!released) {
                releasedCondition.awaitUninterruptibly();
            }
        } finally {
            lock.unlock();
        }
    }

    public void release() {
        lock.lock();
        try {
            released = true;
            releasedCondition.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void rearm() {
        lock.lock();
        try {
            released = false;
        } finally {
            lock.unlock();
        }
    }

    public boolean isReleased() {
        lock.lock();
        try {
            return released;
        } finally {
            lock.unlock();
        }
    }
}
