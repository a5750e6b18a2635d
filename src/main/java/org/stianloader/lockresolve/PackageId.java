package org.stianloader.lockresolve;

import java.util.Comparator;

import org.jetbrains.annotations.NotNull;

/**
 * The name and the exact version of a resolved package. Both registry packages and tarball packages
 * are identified this way, with registry package names taking the form {@code @scope/name} and tarball
 * package names being either plain or scoped npm package names.
 *
 * <p>Ordering is lexicographic on the name first and the version second. Versions are deliberately
 * compared as plain strings rather than semantically, as the ordering only exists to make manifests
 * reproducible.
 */
public final record PackageId(@NotNull String name, @NotNull String version) implements Comparable<PackageId> {

    @NotNull
    private static final Comparator<PackageId> ORDER = Comparator.comparing(PackageId::name).thenComparing(PackageId::version);

    @Override
    public int compareTo(@NotNull PackageId o) {
        return PackageId.ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return this.name + '@' + this.version;
    }
}
