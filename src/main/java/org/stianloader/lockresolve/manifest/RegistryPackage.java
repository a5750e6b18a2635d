package org.stianloader.lockresolve.manifest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.lockresolve.PackageId;

/**
 * A resolved JSR package along with every file deno reads when importing it.
 * The source files are ordered by their path within the package and are followed by the
 * package index ({@code meta.json}) and the version index ({@code <version>_meta.json}).
 *
 * @param name The package name in the form {@code @scope/name}
 * @param version The exact version
 * @param integrity The integrity string copied from the lock file
 * @param files The files of the package
 */
public final record RegistryPackage(@NotNull String name, @NotNull String version, @NotNull String integrity, @NotNull List<RegistryFile> files) {

    public RegistryPackage {
        Objects.requireNonNull(name, "name may not be null");
        Objects.requireNonNull(version, "version may not be null");
        Objects.requireNonNull(integrity, "integrity may not be null");
        files = Collections.unmodifiableList(new ArrayList<>(files));
    }

    @NotNull
    @Contract(pure = true)
    public PackageId toPackageId() {
        return new PackageId(this.name, this.version);
    }
}
