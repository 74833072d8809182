package dev.dmcode.looping.executor;

public enum LoopingThreadState {

    EMPTY,

    RUNNING,

    PAUSED,

    EXITING,

    TERMINATED
}
