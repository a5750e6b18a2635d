package org.stianloader.lockresolve.lock;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.lockresolve.PackageId;
import org.stianloader.lockresolve.error.MalformedLockException;

/**
 * A JSR package pinned by the lock file, stored under keys such as {@code @std/path@1.0.8}.
 *
 * @param scope The scope of the package, including the leading '@'
 * @param name The name of the package within its scope
 * @param version The exact version of the package
 * @param integrity The integrity string of the lock entry
 */
public final record RegistryEntry(@NotNull String scope, @NotNull String name, @NotNull String version, @NotNull String integrity) implements LockEntry {

    /**
     * Splits a lock key of the form {@code @scope/name@version} into its components.
     *
     * @param key The lock key
     * @param integrity The integrity string stored for the key
     * @return The parsed entry
     * @throws MalformedLockException If the key does not have the expected form
     */
    @NotNull
    public static RegistryEntry parse(@NotNull String key, @NotNull String integrity) throws MalformedLockException {
        int slash = key.indexOf('/');
        int at = key.lastIndexOf('@');
        if (!key.startsWith("@") || slash <= 1 || at <= slash + 1 || at == key.length() - 1) {
            throw new MalformedLockException("JSR lock key \"" + key + "\" is not of the form @scope/name@version");
        }
        return new RegistryEntry(key.substring(0, slash), key.substring(slash + 1, at), key.substring(at + 1), integrity);
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public String key() {
        return this.scope + '/' + this.name + '@' + this.version;
    }

    @NotNull
    @Contract(pure = true)
    public String packageName() {
        return this.scope + '/' + this.name;
    }

    @NotNull
    @Contract(pure = true)
    public PackageId toPackageId() {
        return new PackageId(this.packageName(), this.version);
    }
}
