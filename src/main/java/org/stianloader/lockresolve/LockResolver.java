package org.stianloader.lockresolve;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.lockresolve.error.MalformedLockException;
import org.stianloader.lockresolve.internal.ConcurrencyUtil;
import org.stianloader.lockresolve.jsr.RegistryPackageResolver;
import org.stianloader.lockresolve.lock.LockFile;
import org.stianloader.lockresolve.logging.LoggingAdapter;
import org.stianloader.lockresolve.manifest.DependencyManifest;
import org.stianloader.lockresolve.manifest.RegistryPackage;
import org.stianloader.lockresolve.manifest.TarballPackage;
import org.stianloader.lockresolve.npm.TarballPackageResolver;
import org.stianloader.lockresolve.repo.RegistryRepository;

/**
 * Resolves a {@code deno.lock} file into a {@link DependencyManifest} listing every remote resource a
 * prepopulated {@code DENO_DIR} has to contain.
 *
 * <p>JSR packages are resolved concurrently, with at most {@link #getConcurrency()} packages in flight at
 * any time. npm packages need no network access. Resolution is all or nothing: if any JSR package fails to
 * resolve, the whole resolution fails with the first observed failure and no manifest is produced.
 * The produced manifest only depends on the lock file and the registry contents, never on the order in
 * which requests complete.
 */
public class LockResolver {

    /**
     * The amount of JSR packages resolved concurrently unless configured otherwise.
     */
    public static final int DEFAULT_CONCURRENCY = 20;

    @NotNull
    private final RegistryPackageResolver registryResolver;
    @NotNull
    private final TarballPackageResolver tarballResolver;
    private int concurrency = LockResolver.DEFAULT_CONCURRENCY;

    /**
     * Creates a resolver against the public JSR and npm registries.
     */
    public LockResolver() {
        this(new RegistryPackageResolver(), new TarballPackageResolver());
    }

    public LockResolver(@NotNull RegistryRepository jsrRegistry) {
        this(new RegistryPackageResolver(jsrRegistry), new TarballPackageResolver());
    }

    public LockResolver(@NotNull RegistryPackageResolver registryResolver, @NotNull TarballPackageResolver tarballResolver) {
        this.registryResolver = Objects.requireNonNull(registryResolver, "registryResolver may not be null");
        this.tarballResolver = Objects.requireNonNull(tarballResolver, "tarballResolver may not be null");
    }

    @Contract(pure = true)
    public int getConcurrency() {
        return this.concurrency;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public LockResolver setConcurrency(int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("The concurrency cap must be at least 1, but was " + concurrency);
        }
        this.concurrency = concurrency;
        return this;
    }

    /**
     * Resolve a lock file.
     *
     * <p>Malformed lock files are rejected right away with a {@link MalformedLockException}. Failures
     * during resolution, such as {@link org.stianloader.lockresolve.error.FetchFailedException} or
     * {@link org.stianloader.lockresolve.error.InvalidInputException}, complete the returned future
     * exceptionally.
     *
     * @param lockData The raw contents of the lock file
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A {@link CompletableFuture} which completes with the resolved manifest
     * @throws MalformedLockException If the lock file cannot be parsed
     */
    @NotNull
    public CompletableFuture<DependencyManifest> resolve(byte @NotNull[] lockData, @NotNull Executor executor) throws MalformedLockException {
        return this.resolve(LockFile.parse(lockData), executor);
    }

    @NotNull
    public CompletableFuture<DependencyManifest> resolve(@NotNull LockFile lock, @NotNull Executor executor) {
        if (!lock.isSupportedVersion()) {
            LoggingAdapter.getDefaultLogger().warn(LockResolver.class, "Unexpected deno.lock version {} (expected 4 or 5)", lock.version());
        }
        LoggingAdapter.getDefaultLogger().info(LockResolver.class, "Resolving {} JSR + {} npm packages", lock.registryEntries().size(), lock.tarballEntries().size());

        List<TarballPackage> tarballPackages;
        try {
            tarballPackages = new ArrayList<>(this.tarballResolver.resolveAll(lock.tarballEntries()));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        tarballPackages.sort(Comparator.comparing(TarballPackage::toPackageId));

        return this.registryResolver.resolveAll(lock.registryEntries(), this.concurrency, executor).thenApply((resolved) -> {
            List<RegistryPackage> registryPackages = new ArrayList<>(resolved);
            registryPackages.sort(Comparator.comparing(RegistryPackage::toPackageId));

            int fileCount = 0;
            for (RegistryPackage pkg : registryPackages) {
                fileCount += pkg.files().size();
            }
            LoggingAdapter.getDefaultLogger().info(LockResolver.class, "Resolved {} JSR packages ({} files) + {} npm packages", registryPackages.size(), fileCount, tarballPackages.size());

            return new DependencyManifest(lock.version(), registryPackages, tarballPackages);
        });
    }

    /**
     * Resolve a lock file, blocking the calling thread until resolution completes. Requests are performed on a
     * thread pool owned by this invocation, sized after the {@link #getConcurrency() concurrency cap}.
     *
     * @param lockData The raw contents of the lock file
     * @return The resolved manifest
     * @throws IOException If the lock file is malformed or a request failed
     */
    @NotNull
    public DependencyManifest resolveBlocking(byte @NotNull[] lockData) throws IOException {
        LockFile lock = LockFile.parse(lockData);
        ExecutorService executor = Executors.newFixedThreadPool(this.concurrency, (runnable) -> {
            Thread thread = new Thread(runnable, "lockresolve-fetch");
            thread.setDaemon(true);
            return thread;
        });
        try {
            return this.resolve(lock, executor).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while resolving the lock file", e);
        } catch (ExecutionException e) {
            Throwable cause = ConcurrencyUtil.unwrap(e);
            if (cause instanceof IOException) {
                throw (IOException) cause;
            } else if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IOException(cause);
        } finally {
            executor.shutdownNow();
        }
    }

    @NotNull
    public DependencyManifest resolveBlocking(@NotNull Path lockFile) throws IOException {
        return this.resolveBlocking(Files.readAllBytes(lockFile));
    }

    /**
     * Resolve a lock file and atomically write the resulting manifest. If resolution fails, the manifest file
     * is left untouched.
     *
     * @param lockFile The lock file to resolve
     * @param manifestFile The file to write the manifest to
     * @return The written manifest
     * @throws IOException If resolution or writing fails
     */
    @NotNull
    public DependencyManifest resolveAndWrite(@NotNull Path lockFile, @NotNull Path manifestFile) throws IOException {
        DependencyManifest manifest = this.resolveBlocking(lockFile);
        manifest.save(manifestFile);
        LoggingAdapter.getDefaultLogger().info(LockResolver.class, "Wrote manifest for {} to {}", lockFile, manifestFile);
        return manifest;
    }
}
