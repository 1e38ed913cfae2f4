package com.dcruver.docvalidator.io;

import java.nio.file.Path;

/**
 * Thrown when a run cannot start at all, e.g. the corpus root does not exist.
 * Per-document problems are never reported this way; they become findings.
 */
public class InvalidInvocationException extends RuntimeException {

    private final Path target;

    public InvalidInvocationException(Path target, String message) {
        super(message);
        this.target = target;
    }

    public InvalidInvocationException(Path target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public Path getTarget() {
        return target;
    }
}
