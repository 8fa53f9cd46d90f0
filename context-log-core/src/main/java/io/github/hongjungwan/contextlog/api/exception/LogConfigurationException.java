package io.github.hongjungwan.contextlog.api.exception;

/**
 * A synthesized logging document could not be installed into the logging backend.
 */
public class LogConfigurationException extends ContextLogException {

    public LogConfigurationException(String message) {
        super(message);
    }

    public LogConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
