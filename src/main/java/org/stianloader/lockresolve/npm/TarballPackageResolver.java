package org.stianloader.lockresolve.npm;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.lockresolve.PackageId;
import org.stianloader.lockresolve.error.InvalidInputException;
import org.stianloader.lockresolve.lock.TarballEntry;
import org.stianloader.lockresolve.logging.LoggingAdapter;
import org.stianloader.lockresolve.manifest.TarballPackage;

/**
 * Resolves npm packages pinned by a lock file into tarball downloads. Resolution happens without any
 * network access, as npm registries serve tarballs at a fixed location:
 * {@code <registry>/<name>/-/<basename>-<version>.tgz}.
 */
public class TarballPackageResolver {

    @NotNull
    public static final String DEFAULT_REGISTRY = "https://registry.npmjs.org";

    @NotNull
    private final String registry;
    @NotNull
    private final String registryHost;

    public TarballPackageResolver() {
        this(URI.create(TarballPackageResolver.DEFAULT_REGISTRY));
    }

    public TarballPackageResolver(@NotNull URI registry) {
        String host = registry.getHost();
        if (host == null) {
            throw new IllegalArgumentException("The registry URI " + registry + " has no host");
        }
        String url = registry.toString();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        this.registry = url;
        this.registryHost = host;
    }

    /**
     * Split a lock key into the package name and version. Keys of scoped packages start with an '@', so the
     * version separator is the second '@' for them. Peer dependency qualifiers (everything from the first
     * underscore of the version onwards) are discarded, so {@code @scope/name@1.2.3_peer@4.5.6} is
     * parsed as {@code @scope/name} in version {@code 1.2.3}.
     *
     * @param key The npm lock key
     * @return The package name and version
     * @throws InvalidInputException If the key has no version or no name
     */
    @NotNull
    @Contract(pure = true)
    public static PackageId parseKey(@NotNull String key) {
        int at = key.indexOf('@', key.startsWith("@") ? 1 : 0);
        if (at <= 0) {
            throw new InvalidInputException("npm lock key \"" + key + "\" does not contain a version");
        }

        String name = key.substring(0, at);
        String version = key.substring(at + 1);
        int peerQualifier = version.indexOf('_');
        if (peerQualifier != -1) {
            version = version.substring(0, peerQualifier);
        }
        if (version.isEmpty()) {
            throw new InvalidInputException("npm lock key \"" + key + "\" has an empty version");
        }
        return new PackageId(name, version);
    }

    @NotNull
    @Contract(pure = true)
    public String getTarballURL(@NotNull PackageId id) {
        String basename = id.name().substring(id.name().lastIndexOf('/') + 1);
        return this.registry + '/' + id.name() + "/-/" + basename + '-' + id.version() + ".tgz";
    }

    /**
     * Obtains the directory relative to {@code DENO_DIR} in which deno stores an npm package.
     * The location only depends on the registry host, the name and the version.
     *
     * @param id The package
     * @return The cache path of the package
     */
    @NotNull
    @Contract(pure = true)
    public String getCachePath(@NotNull PackageId id) {
        return "npm/" + this.registryHost + '/' + id.name() + '/' + id.version();
    }

    /**
     * Resolve the given lock entries, keeping only the first entry for every name and version pair.
     * Later entries which only differ in their peer dependency qualifier are dropped; if their integrity
     * string differs from the one of the kept entry, a warning is logged.
     *
     * @param entries The lock entries, in lock file order
     * @return The resolved packages, in the order of their first occurrence
     */
    @NotNull
    public List<TarballPackage> resolveAll(@NotNull Collection<TarballEntry> entries) {
        Map<PackageId, TarballEntry> firstSeen = new LinkedHashMap<>();
        for (TarballEntry entry : entries) {
            PackageId id = TarballPackageResolver.parseKey(entry.key());
            TarballEntry kept = firstSeen.putIfAbsent(id, entry);
            if (kept != null && !kept.integrity().equals(entry.integrity())) {
                LoggingAdapter.getDefaultLogger().warn(TarballPackageResolver.class, "npm lock entries {} and {} resolve to {} but have different integrity strings; keeping the integrity of {}", kept.key(), entry.key(), id, kept.key());
            }
        }

        List<TarballPackage> packages = new ArrayList<>(firstSeen.size());
        for (Map.Entry<PackageId, TarballEntry> e : firstSeen.entrySet()) {
            PackageId id = e.getKey();
            packages.add(new TarballPackage(id.name(), id.version(), e.getValue().integrity(), this.getTarballURL(id), this.getCachePath(id)));
        }
        return packages;
    }
}
