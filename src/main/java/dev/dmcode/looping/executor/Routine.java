package dev.dmcode.looping.executor;

@FunctionalInterface
public interface Routine {

    void run() throws Exception;
}
