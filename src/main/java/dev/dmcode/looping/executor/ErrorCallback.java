package dev.dmcode.looping.executor;

@FunctionalInterface
public interface ErrorCallback {

    void onError(Exception exception);

    static ErrorCallback logging() {
        return LoggingErrorCallback.INSTANCE;
    }
}
