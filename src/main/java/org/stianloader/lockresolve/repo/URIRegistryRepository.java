package org.stianloader.lockresolve.repo;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URLConnection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.lockresolve.error.FetchFailedException;
import org.stianloader.lockresolve.internal.ConcurrencyUtil;
import org.stianloader.lockresolve.logging.LoggingAdapter;

/**
 * A {@link RegistryRepository} fetching resources over HTTP(S) through {@link URLConnection}.
 * Requests are performed synchronously on the executor passed to {@link #getResource(String, Executor)}.
 */
public class URIRegistryRepository implements RegistryRepository {

    /**
     * The default connect and read timeout, in milliseconds.
     */
    public static final int DEFAULT_TIMEOUT = 30_000;

    @NotNull
    private final String base;
    private int connectTimeout = URIRegistryRepository.DEFAULT_TIMEOUT;
    private int readTimeout = URIRegistryRepository.DEFAULT_TIMEOUT;

    public URIRegistryRepository(@NotNull URI base) {
        String url = base.toString();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        this.base = url;
    }

    protected byte @NotNull[] getResource0(@NotNull String path) throws IOException {
        String url = this.getResourceURL(path);
        LoggingAdapter.getDefaultLogger().debug(URIRegistryRepository.class, "Downloading {}", url);

        URLConnection connection;
        try {
            connection = URI.create(url).toURL().openConnection();
            connection.setConnectTimeout(this.connectTimeout);
            connection.setReadTimeout(this.readTimeout);
            if (connection instanceof HttpURLConnection) {
                HttpURLConnection httpUrlConn = (HttpURLConnection) connection;
                int status = httpUrlConn.getResponseCode();
                if ((status / 100) != 2) {
                    String reason = httpUrlConn.getResponseMessage();
                    httpUrlConn.disconnect();
                    throw new FetchFailedException(url, status, reason == null ? "no reason given" : reason);
                }
            }
        } catch (FetchFailedException e) {
            throw e;
        } catch (IOException | IllegalArgumentException e) {
            throw new FetchFailedException(url, e);
        }

        try (InputStream is = connection.getInputStream()) {
            return is.readAllBytes();
        } catch (IOException e) {
            throw new FetchFailedException(url, e);
        }
    }

    @Override
    @NotNull
    public CompletableFuture<byte[]> getResource(@NotNull String path, @NotNull Executor executor) {
        return ConcurrencyUtil.schedule(() -> {
            return this.getResource0(path);
        }, executor);
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public String getResourceURL(@NotNull String path) {
        return this.base + '/' + path;
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public String getPlaintextURL() {
        return this.base;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_, _ -> this")
    public URIRegistryRepository setTimeouts(int connectTimeout, int readTimeout) {
        if (connectTimeout < 0 || readTimeout < 0) {
            throw new IllegalArgumentException("Timeouts may not be negative");
        }
        this.connectTimeout = connectTimeout;
        this.readTimeout = readTimeout;
        return this;
    }
}
