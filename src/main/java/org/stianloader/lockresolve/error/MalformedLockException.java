package org.stianloader.lockresolve.error;

import java.io.IOException;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a lock file is not valid JSON or lacks the fields required to interpret it.
 * No resolution is attempted for a lock file that fails to parse.
 */
public class MalformedLockException extends IOException {

    private static final long serialVersionUID = 4120937523816049716L;

    public MalformedLockException(@NotNull String message) {
        super(message);
    }

    public MalformedLockException(@NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
