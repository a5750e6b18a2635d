package org.stianloader.lockresolve.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.junit.jupiter.api.Test;
import org.stianloader.lockresolve.cache.CachePaths;
import org.stianloader.lockresolve.error.FetchFailedException;
import org.stianloader.lockresolve.error.InvalidInputException;
import org.stianloader.lockresolve.jsr.RegistryPackageResolver;
import org.stianloader.lockresolve.lock.RegistryEntry;
import org.stianloader.lockresolve.manifest.RegistryFile;
import org.stianloader.lockresolve.manifest.RegistryPackage;

public class RegistryPackageResolverTest {

    private static final String SHA_A = "aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";
    private static final String SHA_B = "bbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb";

    @Test
    public void testFileOrder() throws Exception {
        StubRegistryRepository registry = new StubRegistryRepository()
                .putPackage("@x/y", "1.0.0", "/b.json", "sha256-" + SHA_B, "/a.ts", "sha256-" + SHA_A);
        RegistryPackageResolver resolver = new RegistryPackageResolver(registry);

        RegistryPackage pkg = resolver.resolve(new RegistryEntry("@x", "y", "1.0.0", "sha256-deadbeef"), Runnable::run).get();
        assertEquals("@x/y", pkg.name());
        assertEquals("1.0.0", pkg.version());
        assertEquals("sha256-deadbeef", pkg.integrity());

        List<RegistryFile> files = pkg.files();
        assertEquals(4, files.size());
        assertEquals(new RegistryFile("https://jsr.io/@x/y/1.0.0/a.ts", SHA_A, CachePaths.urlToCachePath("https://jsr.io/@x/y/1.0.0/a.ts"), "text/typescript"), files.get(0));
        assertEquals(new RegistryFile("https://jsr.io/@x/y/1.0.0/b.json", SHA_B, CachePaths.urlToCachePath("https://jsr.io/@x/y/1.0.0/b.json"), "application/json"), files.get(1));

        RegistryFile packageIndex = files.get(2);
        assertEquals("https://jsr.io/@x/y/meta.json", packageIndex.url());
        assertEquals(CachePaths.sha256Hex(registry.getContents("@x/y/meta.json")), packageIndex.sha256());
        assertEquals(CachePaths.urlToCachePath("https://jsr.io/@x/y/meta.json"), packageIndex.cachePath());
        assertEquals("application/json", packageIndex.mediaType());

        RegistryFile versionIndex = files.get(3);
        assertEquals("https://jsr.io/@x/y/1.0.0_meta.json", versionIndex.url());
        assertEquals(CachePaths.sha256Hex(registry.getContents("@x/y/1.0.0_meta.json")), versionIndex.sha256());
        assertEquals(CachePaths.urlToCachePath("https://jsr.io/@x/y/1.0.0_meta.json"), versionIndex.cachePath());
    }

    @Test
    public void testRequestsAreSequentialAndUnique() throws Exception {
        StubRegistryRepository registry = new StubRegistryRepository()
                .putPackage("@x/y", "1.0.0", "/mod.ts", "sha256-" + SHA_A);
        new RegistryPackageResolver(registry).resolve(new RegistryEntry("@x", "y", "1.0.0", "i"), Runnable::run).get();
        assertEquals(Arrays.asList("@x/y/1.0.0_meta.json", "@x/y/meta.json"), registry.getRequests());
    }

    @Test
    public void testEmptyPackageStillListsIndices() throws Exception {
        StubRegistryRepository registry = new StubRegistryRepository().putPackage("@x/empty", "0.1.0");
        RegistryPackage pkg = new RegistryPackageResolver(registry).resolve(new RegistryEntry("@x", "empty", "0.1.0", "i"), Runnable::run).get();
        assertEquals(2, pkg.files().size());
        assertEquals("https://jsr.io/@x/empty/meta.json", pkg.files().get(0).url());
        assertEquals("https://jsr.io/@x/empty/0.1.0_meta.json", pkg.files().get(1).url());
    }

    @Test
    public void testMissingVersionIndex() {
        StubRegistryRepository registry = new StubRegistryRepository();
        CompletableFuture<RegistryPackage> future = new RegistryPackageResolver(registry).resolve(new RegistryEntry("@x", "y", "1.0.0", "i"), Runnable::run);
        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        FetchFailedException cause = assertInstanceOf(FetchFailedException.class, e.getCause());
        assertEquals(404, cause.getStatus());
        assertEquals("https://jsr.io/@x/y/1.0.0_meta.json", cause.getURL());
    }

    @Test
    public void testMissingPackageIndex() {
        StubRegistryRepository registry = new StubRegistryRepository()
                .put("@x/y/1.0.0_meta.json", "{\"manifest\": {}}");
        CompletableFuture<RegistryPackage> future = new RegistryPackageResolver(registry).resolve(new RegistryEntry("@x", "y", "1.0.0", "i"), Runnable::run);
        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        FetchFailedException cause = assertInstanceOf(FetchFailedException.class, e.getCause());
        assertEquals("https://jsr.io/@x/y/meta.json", cause.getURL());
    }

    @Test
    public void testChecksumPrefixRequired() {
        StubRegistryRepository registry = new StubRegistryRepository()
                .putPackage("@x/y", "1.0.0", "/mod.ts", "sha512-" + SHA_A);
        CompletableFuture<RegistryPackage> future = new RegistryPackageResolver(registry).resolve(new RegistryEntry("@x", "y", "1.0.0", "i"), Runnable::run);
        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(InvalidInputException.class, e.getCause());
    }

    @Test
    public void testStripChecksumPrefix() {
        assertEquals(SHA_A, RegistryPackageResolver.stripChecksumPrefix("sha256-" + SHA_A));
        assertThrows(InvalidInputException.class, () -> RegistryPackageResolver.stripChecksumPrefix(SHA_A));
        assertThrows(InvalidInputException.class, () -> RegistryPackageResolver.stripChecksumPrefix("sha256-xyz"));
        assertThrows(InvalidInputException.class, () -> RegistryPackageResolver.stripChecksumPrefix("SHA256-" + SHA_A));
    }

    @Test
    public void testMalformedVersionIndex() {
        StubRegistryRepository registry = new StubRegistryRepository()
                .put("@x/y/meta.json", "{}")
                .put("@x/y/1.0.0_meta.json", "{\"manifest\": {\"/mod.ts\": {\"size\": 3}}}")
                .put("@x/z/meta.json", "{}")
                .put("@x/z/1.0.0_meta.json", "<html>");
        RegistryPackageResolver resolver = new RegistryPackageResolver(registry);

        ExecutionException e = assertThrows(ExecutionException.class, resolver.resolve(new RegistryEntry("@x", "y", "1.0.0", "i"), Runnable::run)::get);
        assertInstanceOf(InvalidInputException.class, e.getCause());
        e = assertThrows(ExecutionException.class, resolver.resolve(new RegistryEntry("@x", "z", "1.0.0", "i"), Runnable::run)::get);
        assertInstanceOf(InvalidInputException.class, e.getCause());
    }
}
