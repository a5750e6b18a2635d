package org.stianloader.lockresolve.lock;

import org.jetbrains.annotations.NotNull;

/**
 * An npm package pinned by the lock file. The key is kept verbatim, as it may carry a peer dependency
 * qualifier (e.g. {@code @scope/name@1.2.3_react@18.2.0}) which is only stripped during resolution by
 * {@link org.stianloader.lockresolve.npm.TarballPackageResolver#parseKey(String)}.
 *
 * @param key The verbatim lock key
 * @param integrity The integrity string of the lock entry
 */
public final record TarballEntry(@NotNull String key, @NotNull String integrity) implements LockEntry {
}
