package dev.blanke.ilpatcher.module;

import java.io.IOException;

/**
 * Signals that a file is not a well-formed CLI module: its PE container, CLI header, or metadata could not be
 * parsed.
 */
public final class ModuleFormatException extends IOException {

    public ModuleFormatException(final String message) {
        super(message);
    }

    public ModuleFormatException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
