package org.stianloader.lockresolve.error;

import java.io.IOException;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a persisted manifest cannot be read back into a
 * {@link org.stianloader.lockresolve.manifest.DependencyManifest}.
 */
public class MalformedManifestException extends IOException {

    private static final long serialVersionUID = -2587046517210917385L;

    public MalformedManifestException(@NotNull String message) {
        super(message);
    }

    public MalformedManifestException(@NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
