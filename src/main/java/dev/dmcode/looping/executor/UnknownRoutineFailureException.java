package dev.dmcode.looping.executor;

public class UnknownRoutineFailureException extends RuntimeException {

    static final String MESSAGE = "Unknown error in periodic task";

    public UnknownRoutineFailureException(Throwable cause) {
        super(MESSAGE, cause);
    }
}
