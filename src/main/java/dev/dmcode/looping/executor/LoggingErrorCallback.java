package dev.dmcode.looping.executor;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class LoggingErrorCallback implements ErrorCallback {

    static final LoggingErrorCallback INSTANCE = new LoggingErrorCallback();

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingErrorCallback.class);

    @Override
    public void onError(Exception exception) {
        LOGGER.error("Periodic routine execution exception", exception);
    }
}
