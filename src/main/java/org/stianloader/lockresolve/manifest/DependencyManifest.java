package org.stianloader.lockresolve.manifest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.lockresolve.error.MalformedManifestException;
import org.stianloader.lockresolve.internal.AtomicFiles;
import org.stianloader.lockresolve.internal.JsonSupport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The complete, flat list of remote resources needed to populate a {@code DENO_DIR} for a lock file.
 *
 * <p>The serialized form is meant to be committed to version control and consumed by a deterministic
 * builder. {@link #serialize()} therefore always produces the same text for equal manifests: object keys
 * are sorted, indentation is fixed to two spaces and the document ends with a newline. Package lists are
 * expected to be sorted by name and version already, which {@link org.stianloader.lockresolve.LockResolver}
 * guarantees.
 *
 * @param lockVersion The version of the lock file the manifest was resolved from
 * @param registryPackages The resolved JSR packages
 * @param tarballPackages The resolved npm packages
 */
public final record DependencyManifest(@NotNull String lockVersion, @NotNull List<RegistryPackage> registryPackages, @NotNull List<TarballPackage> tarballPackages) {

    public DependencyManifest {
        Objects.requireNonNull(lockVersion, "lockVersion may not be null");
        registryPackages = Collections.unmodifiableList(new ArrayList<>(registryPackages));
        tarballPackages = Collections.unmodifiableList(new ArrayList<>(tarballPackages));
    }

    @NotNull
    @Contract(pure = true)
    public String serialize() {
        Map<String, Object> root = new TreeMap<>();
        root.put("lock_version", this.lockVersion);

        List<Map<String, Object>> jsr = new ArrayList<>();
        for (RegistryPackage pkg : this.registryPackages) {
            List<Map<String, Object>> files = new ArrayList<>();
            for (RegistryFile file : pkg.files()) {
                Map<String, Object> fileData = new TreeMap<>();
                fileData.put("url", file.url());
                fileData.put("sha256", file.sha256());
                fileData.put("cache_path", file.cachePath());
                fileData.put("media_type", file.mediaType());
                files.add(fileData);
            }
            Map<String, Object> pkgData = new TreeMap<>();
            pkgData.put("name", pkg.name());
            pkgData.put("version", pkg.version());
            pkgData.put("integrity", pkg.integrity());
            pkgData.put("files", files);
            jsr.add(pkgData);
        }
        root.put("jsr_packages", jsr);

        List<Map<String, Object>> npm = new ArrayList<>();
        for (TarballPackage pkg : this.tarballPackages) {
            Map<String, Object> pkgData = new TreeMap<>();
            pkgData.put("name", pkg.name());
            pkgData.put("version", pkg.version());
            pkgData.put("integrity", pkg.integrity());
            pkgData.put("tarball_url", pkg.tarballUrl());
            pkgData.put("cache_path", pkg.cachePath());
            npm.add(pkgData);
        }
        root.put("npm_packages", npm);

        try {
            return JsonSupport.writeCanonical(root);
        } catch (IOException e) {
            // Only strings, lists and maps are written, none of which can fail to serialize
            throw new IllegalStateException("Unable to serialize manifest", e);
        }
    }

    /**
     * Read a manifest previously written by {@link #serialize()}.
     * Unknown fields are ignored; missing package lists are treated as empty, but every
     * other field is required.
     *
     * @param data The UTF-8 encoded JSON document
     * @return The manifest
     * @throws MalformedManifestException If the document is not a valid manifest
     */
    @NotNull
    public static DependencyManifest deserialize(byte @NotNull[] data) throws MalformedManifestException {
        JsonNode root;
        try {
            root = JsonSupport.readTree(data);
        } catch (JsonProcessingException e) {
            throw new MalformedManifestException("Manifest is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedManifestException("Unable to read manifest", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedManifestException("Manifest must be a JSON object");
        }

        String lockVersion = DependencyManifest.requireText(root, "lock_version", "manifest");

        List<RegistryPackage> registryPackages = new ArrayList<>();
        for (JsonNode pkg : DependencyManifest.optArray(root, "jsr_packages")) {
            String name = DependencyManifest.requireText(pkg, "name", "jsr package");
            String context = "jsr package " + name;
            List<RegistryFile> files = new ArrayList<>();
            JsonNode filesNode = pkg.get("files");
            if (filesNode == null || !filesNode.isArray()) {
                throw new MalformedManifestException("Missing or non-array field \"files\" in " + context);
            }
            for (JsonNode file : filesNode) {
                files.add(new RegistryFile(DependencyManifest.requireText(file, "url", context),
                        DependencyManifest.requireText(file, "sha256", context),
                        DependencyManifest.requireText(file, "cache_path", context),
                        DependencyManifest.requireText(file, "media_type", context)));
            }
            registryPackages.add(new RegistryPackage(name,
                    DependencyManifest.requireText(pkg, "version", context),
                    DependencyManifest.requireText(pkg, "integrity", context),
                    files));
        }

        List<TarballPackage> tarballPackages = new ArrayList<>();
        for (JsonNode pkg : DependencyManifest.optArray(root, "npm_packages")) {
            String name = DependencyManifest.requireText(pkg, "name", "npm package");
            String context = "npm package " + name;
            tarballPackages.add(new TarballPackage(name,
                    DependencyManifest.requireText(pkg, "version", context),
                    DependencyManifest.requireText(pkg, "integrity", context),
                    DependencyManifest.requireText(pkg, "tarball_url", context),
                    DependencyManifest.requireText(pkg, "cache_path", context)));
        }

        return new DependencyManifest(lockVersion, registryPackages, tarballPackages);
    }

    @NotNull
    public static DependencyManifest load(@NotNull Path path) throws IOException {
        return DependencyManifest.deserialize(Files.readAllBytes(path));
    }

    /**
     * Atomically writes the {@link #serialize() serialized} manifest to a file, retaining the
     * permissions of the file if it already exists.
     *
     * @param path The file to write to
     * @throws IOException If writing fails, in which case the previous contents of the file are retained
     */
    public void save(@NotNull Path path) throws IOException {
        AtomicFiles.writeString(path, this.serialize());
    }

    @NotNull
    private static String requireText(@NotNull JsonNode node, @NotNull String field, @NotNull String context) throws MalformedManifestException {
        if (!node.isObject()) {
            throw new MalformedManifestException("Expected an object for " + context);
        }
        String value = JsonSupport.optText(node, field);
        if (value == null) {
            throw new MalformedManifestException("Missing or non-string field \"" + field + "\" in " + context);
        }
        return value;
    }

    @NotNull
    private static Iterable<JsonNode> optArray(@NotNull JsonNode node, @NotNull String field) throws MalformedManifestException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Collections.emptyList();
        }
        if (!value.isArray()) {
            throw new MalformedManifestException("Field \"" + field + "\" must be an array");
        }
        return value;
    }
}
