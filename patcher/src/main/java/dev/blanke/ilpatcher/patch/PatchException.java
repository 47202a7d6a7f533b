package dev.blanke.ilpatcher.patch;

import java.util.Objects;

/**
 * Signals that a method could not be patched for one of the reasons enumerated by {@link PatchFailure}.
 */
public final class PatchException extends Exception {

    private final PatchFailure failure;

    public PatchException(final PatchFailure failure, final String message) {
        super(message);
        this.failure = Objects.requireNonNull(failure);
    }

    public PatchFailure getFailure() {
        return failure;
    }
}
