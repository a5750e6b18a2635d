package org.stianloader.lockresolve.error;

import java.io.IOException;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown when fetching a remote resource did not succeed, either because the server answered
 * with a status code outside of the 2xx range or because the transport failed altogether.
 */
public class FetchFailedException extends IOException {

    /**
     * The status reported by {@link #getStatus()} when no HTTP response was received.
     */
    public static final int NO_STATUS = -1;

    private static final long serialVersionUID = -8012771389431306529L;

    @NotNull
    private final String url;
    private final int status;

    public FetchFailedException(@NotNull String url, int status, @NotNull String reason) {
        super("Query for " + url + " returned with a response code of " + status + " (" + reason + ")");
        this.url = url;
        this.status = status;
    }

    public FetchFailedException(@NotNull String url, @NotNull Throwable cause) {
        super("Unable to fetch " + url + ": " + cause, cause);
        this.url = url;
        this.status = FetchFailedException.NO_STATUS;
    }

    @NotNull
    @Contract(pure = true)
    public String getURL() {
        return this.url;
    }

    /**
     * Obtains the HTTP status code of the failed request.
     *
     * @return The status code, or {@link #NO_STATUS} if the failure happened before a response was received
     */
    @Contract(pure = true)
    public int getStatus() {
        return this.status;
    }
}
