package dev.dmcode.looping.executor;

import lombok.With;

import java.time.Duration;

@With
record LoopingThreadSettings(
    Duration period,
    boolean catchUp,
    ErrorCallback errorCallback
) {
    static LoopingThreadSettings of(LoopingThreadConfiguration configuration) {
        return new LoopingThreadSettings(configuration.period(), configuration.catchUp(), ErrorCallback.logging());
    }

    long periodNanos() {
        return period.toNanos();
    }
}
