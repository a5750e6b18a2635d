package org.stianloader.lockresolve.error;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a value derived during resolution violates a precondition, for example a
 * non-https URL handed to the cache path deriver or a checksum without its algorithm prefix.
 * The item being processed fails and with it the package and the run that contain it.
 */
public class InvalidInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 6691837350271043052L;

    public InvalidInputException(@NotNull String message) {
        super(message);
    }

    public InvalidInputException(@NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
