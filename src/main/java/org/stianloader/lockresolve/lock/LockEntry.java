package org.stianloader.lockresolve.lock;

import org.jetbrains.annotations.NotNull;

/**
 * A single package entry of a {@link LockFile}. Entries are either packages served file by file
 * from the JSR registry ({@link RegistryEntry}) or npm packages distributed as tarballs
 * ({@link TarballEntry}).
 */
public sealed interface LockEntry permits RegistryEntry, TarballEntry {

    /**
     * Obtains the key under which the entry is stored in the lock file.
     *
     * @return The verbatim lock key
     */
    @NotNull
    String key();

    /**
     * Obtains the integrity string of the entry. The string is opaque to the resolver and is copied
     * into the manifest as-is.
     *
     * @return The integrity string
     */
    @NotNull
    String integrity();
}
