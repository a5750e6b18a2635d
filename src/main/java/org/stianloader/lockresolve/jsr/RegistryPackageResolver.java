package org.stianloader.lockresolve.jsr;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.lockresolve.cache.CachePaths;
import org.stianloader.lockresolve.error.InvalidInputException;
import org.stianloader.lockresolve.internal.BoundedMultiCompletableFuture;
import org.stianloader.lockresolve.internal.ConcurrencyUtil;
import org.stianloader.lockresolve.internal.JsonSupport;
import org.stianloader.lockresolve.lock.RegistryEntry;
import org.stianloader.lockresolve.logging.LoggingAdapter;
import org.stianloader.lockresolve.manifest.RegistryFile;
import org.stianloader.lockresolve.manifest.RegistryPackage;
import org.stianloader.lockresolve.repo.RegistryRepository;
import org.stianloader.lockresolve.repo.URIRegistryRepository;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Resolves JSR packages into the list of files deno fetches when importing them.
 *
 * <p>JSR does not distribute packages as archives. Instead, every version publishes a
 * {@code <version>_meta.json} document listing each file of the package alongside its checksum, and deno
 * fetches the files one by one. On top of the source files deno also reads the package index
 * ({@code meta.json}) and the version index itself while resolving imports, so both end up in the module cache
 * as well. As the indices carry no published checksum, they are downloaded and hashed here.
 */
public class RegistryPackageResolver {

    @NotNull
    public static final String DEFAULT_REGISTRY = "https://jsr.io";

    @NotNull
    private static final String CHECKSUM_PREFIX = "sha256-";

    @NotNull
    private static final Pattern SHA256_HEX = Pattern.compile("[0-9a-f]{64}");

    @NotNull
    private static final String INDEX_MEDIA_TYPE = "application/json";

    @NotNull
    private final RegistryRepository repository;

    public RegistryPackageResolver() {
        this(new URIRegistryRepository(URI.create(RegistryPackageResolver.DEFAULT_REGISTRY)));
    }

    public RegistryPackageResolver(@NotNull RegistryRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository may not be null");
    }

    @NotNull
    @Contract(pure = true)
    public RegistryRepository getRepository() {
        return this.repository;
    }

    /**
     * Resolve a single JSR package. The version index is requested first, followed by the package index;
     * the two requests are never issued concurrently.
     *
     * @param entry The lock entry of the package
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A {@link CompletableFuture} which completes with the resolved package, or exceptionally if any
     * request fails or the version index is malformed
     */
    @NotNull
    public CompletableFuture<RegistryPackage> resolve(@NotNull RegistryEntry entry, @NotNull Executor executor) {
        String packagePath = entry.scope() + '/' + entry.name();
        String packageIndexPath = packagePath + "/meta.json";
        String versionIndexPath = packagePath + '/' + entry.version() + "_meta.json";

        return this.repository.getResource(versionIndexPath, executor).thenCompose((versionIndex) -> {
            List<RegistryFile> files = this.readSourceFiles(entry, versionIndexPath, versionIndex);
            return this.repository.getResource(packageIndexPath, executor).thenApply((packageIndex) -> {
                files.add(this.createIndexFile(packageIndexPath, packageIndex));
                files.add(this.createIndexFile(versionIndexPath, versionIndex));
                LoggingAdapter.getDefaultLogger().debug(RegistryPackageResolver.class, "Resolved {} into {} files", entry.key(), files.size());
                return new RegistryPackage(entry.packageName(), entry.version(), entry.integrity(), files);
            });
        });
    }

    /**
     * Resolve all given JSR packages, keeping at most {@code concurrency} packages in flight at once.
     * The returned future fails with the first failure of any package; no partial result is ever produced.
     *
     * @param entries The lock entries of the packages
     * @param concurrency The maximum amount of packages resolved concurrently
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A {@link CompletableFuture} storing the resolved packages in the order of the entries
     */
    @NotNull
    public CompletableFuture<List<RegistryPackage>> resolveAll(@NotNull List<RegistryEntry> entries, int concurrency, @NotNull Executor executor) {
        return new BoundedMultiCompletableFuture<>(entries, concurrency, (entry) -> {
            CompletableFuture<RegistryPackage> future = this.resolve(entry, executor);
            future.exceptionally((ex) -> {
                LoggingAdapter.getDefaultLogger().error(RegistryPackageResolver.class, "Failed to resolve JSR package {}: {}", entry.key(), ConcurrencyUtil.unwrap(ex).getMessage());
                return null;
            });
            return future;
        });
    }

    @NotNull
    private List<RegistryFile> readSourceFiles(@NotNull RegistryEntry entry, @NotNull String versionIndexPath, byte @NotNull[] versionIndex) {
        JsonNode root;
        try {
            root = JsonSupport.readTree(versionIndex);
        } catch (IOException e) {
            throw new InvalidInputException("Version index " + this.repository.getResourceURL(versionIndexPath) + " is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidInputException("Version index " + this.repository.getResourceURL(versionIndexPath) + " is not a JSON object");
        }

        JsonNode manifest = root.get("manifest");
        SortedMap<String, JsonNode> sortedManifest = new TreeMap<>();
        if (manifest != null && !manifest.isNull()) {
            if (!manifest.isObject()) {
                throw new InvalidInputException("The \"manifest\" of " + this.repository.getResourceURL(versionIndexPath) + " is not a JSON object");
            }
            for (Iterator<String> it = manifest.fieldNames(); it.hasNext();) {
                String name = it.next();
                sortedManifest.put(name, manifest.get(name));
            }
        }

        List<RegistryFile> files = new ArrayList<>(sortedManifest.size() + 2);
        for (Map.Entry<String, JsonNode> file : sortedManifest.entrySet()) {
            String filePath = file.getKey();
            if (!filePath.startsWith("/")) {
                throw new InvalidInputException("File path \"" + filePath + "\" of " + entry.key() + " is not absolute");
            }
            String checksum = JsonSupport.optText(file.getValue(), "checksum");
            if (checksum == null) {
                throw new InvalidInputException("File " + filePath + " of " + entry.key() + " declares no checksum");
            }
            String url = this.repository.getResourceURL(entry.scope() + '/' + entry.name() + '/' + entry.version() + filePath);
            files.add(new RegistryFile(url, RegistryPackageResolver.stripChecksumPrefix(checksum), CachePaths.urlToCachePath(url), CachePaths.guessMediaType(filePath)));
        }
        return files;
    }

    @NotNull
    private RegistryFile createIndexFile(@NotNull String path, byte @NotNull[] contents) {
        String url = this.repository.getResourceURL(path);
        return new RegistryFile(url, CachePaths.sha256Hex(contents), CachePaths.urlToCachePath(url), RegistryPackageResolver.INDEX_MEDIA_TYPE);
    }

    /**
     * Converts a JSR checksum of the form {@code sha256-<hex>} into the bare hex digest.
     *
     * @param checksum The checksum as published by JSR
     * @return The lowercase hex digest
     * @throws InvalidInputException If the checksum is not a SHA-256 checksum in the expected form
     */
    @NotNull
    @Contract(pure = true)
    public static String stripChecksumPrefix(@NotNull String checksum) {
        if (!checksum.startsWith(RegistryPackageResolver.CHECKSUM_PREFIX)) {
            throw new InvalidInputException("Checksum \"" + checksum + "\" does not start with \"" + RegistryPackageResolver.CHECKSUM_PREFIX + "\"");
        }
        String hex = checksum.substring(RegistryPackageResolver.CHECKSUM_PREFIX.length());
        if (!RegistryPackageResolver.SHA256_HEX.matcher(hex).matches()) {
            throw new InvalidInputException("Checksum \"" + checksum + "\" is not a lowercase hex encoded SHA-256 digest");
        }
        return hex;
    }
}
