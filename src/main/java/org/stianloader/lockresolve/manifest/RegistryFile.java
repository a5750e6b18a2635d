package org.stianloader.lockresolve.manifest;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * A remote file belonging to a resolved JSR package. Two files are the same file if they share
 * their {@link #url() URL}.
 *
 * @param url The URL the file is fetched from
 * @param sha256 The lowercase hex encoded SHA-256 digest of the file contents, without algorithm prefix
 * @param cachePath The path relative to {@code DENO_DIR} where deno expects the file
 * @param mediaType The media type deno should assume for the file
 */
public final record RegistryFile(@NotNull String url, @NotNull String sha256, @NotNull String cachePath, @NotNull String mediaType) {

    public RegistryFile {
        Objects.requireNonNull(url, "url may not be null");
        Objects.requireNonNull(sha256, "sha256 may not be null");
        Objects.requireNonNull(cachePath, "cachePath may not be null");
        Objects.requireNonNull(mediaType, "mediaType may not be null");
    }
}
