package org.stianloader.lockresolve.repo;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * A remote registry serving files below a base URL. Implementations only need to fetch
 * raw bytes; interpreting them is the task of the resolvers.
 */
public interface RegistryRepository {

    /**
     * Fetch a resource from the registry.
     *
     * <p>The returned {@link CompletableFuture} completes exceptionally with a
     * {@link org.stianloader.lockresolve.error.FetchFailedException} if the registry answers with a status
     * outside of the 2xx range or if the resource could not be fetched at all.
     *
     * @param path The path relative to the registry root, without a leading slash
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A {@link CompletableFuture} which upon normal completion stores the raw bytes of the resource
     */
    @NotNull
    CompletableFuture<byte[]> getResource(@NotNull String path, @NotNull Executor executor);

    /**
     * Obtains the absolute URL of a resource of this registry, as it would be requested by
     * {@link #getResource(String, Executor)}.
     *
     * @param path The path relative to the registry root, without a leading slash
     * @return The absolute URL
     */
    @NotNull
    @Contract(pure = true)
    String getResourceURL(@NotNull String path);

    /**
     * Obtains the base URL of the registry, without trailing slash.
     *
     * @return The base URL
     */
    @NotNull
    @Contract(pure = true)
    String getPlaintextURL();
}
