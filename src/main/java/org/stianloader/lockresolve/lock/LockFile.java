package org.stianloader.lockresolve.lock;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.lockresolve.error.MalformedLockException;
import org.stianloader.lockresolve.internal.JsonSupport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The parsed contents of a {@code deno.lock} file. Only the parts relevant for populating a module cache
 * are retained: the lock format version and the pinned JSR and npm packages. Entries are kept in the
 * order in which they appear in the document.
 *
 * @param version The lock format version, usually "4" or "5"
 * @param registryEntries The pinned JSR packages
 * @param tarballEntries The pinned npm packages
 */
public final record LockFile(@NotNull String version, @NotNull List<RegistryEntry> registryEntries, @NotNull List<TarballEntry> tarballEntries) {

    public LockFile {
        Objects.requireNonNull(version, "version may not be null");
        registryEntries = Collections.unmodifiableList(new ArrayList<>(registryEntries));
        tarballEntries = Collections.unmodifiableList(new ArrayList<>(tarballEntries));
    }

    @Contract(pure = true)
    public boolean isSupportedVersion() {
        return this.version.equals("4") || this.version.equals("5");
    }

    @NotNull
    public static LockFile parse(@NotNull Path path) throws IOException {
        return LockFile.parse(Files.readAllBytes(path));
    }

    /**
     * Parse a lock file from its raw bytes.
     *
     * <p>Lock versions 4 and 5 store the {@code jsr} and {@code npm} sections at the top level of the document.
     * Older lock files nest them in a {@code packages} object, which is read if neither top-level section exists.
     * Absent sections are treated as empty.
     *
     * @param data The UTF-8 encoded JSON document
     * @return The parsed lock file
     * @throws MalformedLockException If the document is not valid JSON or misses required fields
     */
    @NotNull
    public static LockFile parse(byte @NotNull[] data) throws MalformedLockException {
        JsonNode root;
        try {
            root = JsonSupport.readTree(data);
        } catch (JsonProcessingException e) {
            throw new MalformedLockException("Lock file is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedLockException("Unable to read lock file", e);
        }

        if (root == null || !root.isObject()) {
            throw new MalformedLockException("Lock file must be a JSON object");
        }

        JsonNode versionNode = root.get("version");
        if (versionNode == null || !versionNode.isValueNode() || versionNode.isNull()) {
            throw new MalformedLockException("Lock file is missing the \"version\" field");
        }

        JsonNode sections = root;
        if (!root.has("jsr") && !root.has("npm") && root.path("packages").isObject()) {
            sections = root.get("packages");
        }

        List<RegistryEntry> registryEntries = new ArrayList<>();
        for (Map.Entry<String, String> entry : LockFile.readSection(sections.get("jsr"), "jsr")) {
            registryEntries.add(RegistryEntry.parse(entry.getKey(), entry.getValue()));
        }

        List<TarballEntry> tarballEntries = new ArrayList<>();
        for (Map.Entry<String, String> entry : LockFile.readSection(sections.get("npm"), "npm")) {
            tarballEntries.add(new TarballEntry(entry.getKey(), entry.getValue()));
        }

        return new LockFile(versionNode.asText(), registryEntries, tarballEntries);
    }

    /**
     * Reads the key to integrity mapping of a section.
     */
    @NotNull
    private static List<Map.Entry<String, String>> readSection(@Nullable JsonNode section, @NotNull String sectionName) throws MalformedLockException {
        List<Map.Entry<String, String>> entries = new ArrayList<>();
        if (section == null || section.isNull()) {
            return entries;
        }
        if (!section.isObject()) {
            throw new MalformedLockException("The \"" + sectionName + "\" section of the lock file must be an object");
        }

        for (Iterator<Map.Entry<String, JsonNode>> it = section.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> field = it.next();
            JsonNode value = field.getValue();
            if (!value.isObject()) {
                throw new MalformedLockException("Lock entry \"" + field.getKey() + "\" in \"" + sectionName + "\" must be an object");
            }
            String integrity = JsonSupport.optText(value, "integrity");
            if (integrity == null) {
                throw new MalformedLockException("Lock entry \"" + field.getKey() + "\" in \"" + sectionName + "\" has no integrity string");
            }
            entries.add(Map.entry(field.getKey(), integrity));
        }

        return entries;
    }
}
