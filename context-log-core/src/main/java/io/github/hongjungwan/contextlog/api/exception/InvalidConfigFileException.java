package io.github.hongjungwan.contextlog.api.exception;

import java.nio.file.Path;

/**
 * Custom logging config file exists but does not hold a YAML mapping.
 */
public class InvalidConfigFileException extends ContextLogException {

    private final Path file;

    public InvalidConfigFileException(Path file) {
        super(String.format("File '%s' is not a valid yaml file", file));
        this.file = file;
    }

    public InvalidConfigFileException(Path file, Throwable cause) {
        super(String.format("File '%s' is not a valid yaml file", file), cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
