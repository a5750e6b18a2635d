package org.stianloader.lockresolve.manifest;

import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.lockresolve.PackageId;

/**
 * A resolved npm package, fetched as a single tarball.
 *
 * @param name The npm package name, possibly scoped
 * @param version The exact version, without peer dependency qualifier
 * @param integrity The integrity string copied from the lock file
 * @param tarballUrl The URL of the tarball
 * @param cachePath The directory relative to {@code DENO_DIR} where deno expects the extracted package
 */
public final record TarballPackage(@NotNull String name, @NotNull String version, @NotNull String integrity, @NotNull String tarballUrl, @NotNull String cachePath) {

    public TarballPackage {
        Objects.requireNonNull(name, "name may not be null");
        Objects.requireNonNull(version, "version may not be null");
        Objects.requireNonNull(integrity, "integrity may not be null");
        Objects.requireNonNull(tarballUrl, "tarballUrl may not be null");
        Objects.requireNonNull(cachePath, "cachePath may not be null");
    }

    @NotNull
    @Contract(pure = true)
    public PackageId toPackageId() {
        return new PackageId(this.name, this.version);
    }
}
