package dev.dmcode.looping.latch;

public enum WaitResult {

    TIMED_OUT,

    SIGNALED
}
