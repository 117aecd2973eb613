package io.admission.scheduler;

/**
 * The unit of work a scheduled task performs once its resources are granted. Implementations should respond to
 * interruption, which is how cancellation reaches them.
 */
@FunctionalInterface
public interface TaskWork {
    void run() throws Exception;
}
