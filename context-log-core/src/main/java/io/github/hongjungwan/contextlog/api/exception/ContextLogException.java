package io.github.hongjungwan.contextlog.api.exception;

/**
 * Base of all failures raised while assembling log contexts or logging configuration.
 * Every subclass is raised during startup and is meant to abort it.
 */
public class ContextLogException extends RuntimeException {

    public ContextLogException(String message) {
        super(message);
    }

    public ContextLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
