package org.stianloader.lockresolve.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.lockresolve.error.InvalidInputException;

/**
 * Derives the locations under which deno's module cache ({@code DENO_DIR}) stores remote resources.
 *
 * <p>The layout produced by {@link #urlToCachePath(String)} has to match the one deno uses byte for byte,
 * as otherwise deno does not find the prepopulated files and falls back to downloading them at runtime.
 * It was reverse-engineered by looking at the contents of a populated {@code DENO_DIR}:
 * files are stored at {@code remote/<scheme>/<host>/<sha256 of path and query>}.
 */
public final class CachePaths {

    private static final String HTTPS_PREFIX = "https://";

    private CachePaths() {
        throw new UnsupportedOperationException("Static utility class");
    }

    @NotNull
    @Contract(pure = true)
    public static String urlToCachePath(@NotNull String url) {
        if (!url.startsWith(CachePaths.HTTPS_PREFIX)) {
            throw new InvalidInputException("Expected https URL: " + url);
        }

        String rest = url.substring(CachePaths.HTTPS_PREFIX.length());
        int slash = rest.indexOf('/');
        String host;
        String path;
        if (slash == -1) {
            host = rest;
            path = "/";
        } else {
            host = rest.substring(0, slash);
            path = rest.substring(slash);
        }

        // The fragment never reaches the server and is not part of the hashed material, not even a bare '#'
        int fragment = path.indexOf('#');
        if (fragment != -1) {
            path = path.substring(0, fragment);
        }

        return "remote/https/" + host + '/' + CachePaths.sha256Hex(path.getBytes(StandardCharsets.UTF_8));
    }

    @NotNull
    @Contract(pure = true)
    public static String guessMediaType(@NotNull String path) {
        if (path.endsWith(".ts") || path.endsWith(".tsx")) {
            return "text/typescript";
        } else if (path.endsWith(".js") || path.endsWith(".jsx") || path.endsWith(".mjs")) {
            return "text/javascript";
        } else if (path.endsWith(".json")) {
            return "application/json";
        } else if (path.endsWith(".wasm")) {
            return "application/wasm";
        }
        return "text/plain";
    }

    /**
     * Hashes the given bytes using SHA-256 and encodes the digest as lowercase hexadecimal characters.
     *
     * @param data The bytes to hash
     * @return The 64 character long hex digest
     */
    @NotNull
    @Contract(pure = true)
    public static String sha256Hex(byte @NotNull[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (NoSuchAlgorithmException e) {
            // Every JVM is required to support SHA-256
            throw new IllegalStateException(e);
        }
    }
}
