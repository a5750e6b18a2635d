package org.stianloader.lockresolve.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.stianloader.lockresolve.cache.CachePaths;
import org.stianloader.lockresolve.error.InvalidInputException;

public class CachePathsTest {

    @Test
    public void testKnownPaths() {
        assertEquals("remote/https/jsr.io/e5d3d4e4308057b025750f79dd17e2d4a272067a0d1086a81f574fbbb347a835", CachePaths.urlToCachePath("https://jsr.io/@std/path/1.0.8/mod.ts"));
        assertEquals("remote/https/jsr.io/5334b42bb2b7dc27810790aff54c17b2c9c97486dd43fc5c5524866460a81632", CachePaths.urlToCachePath("https://jsr.io/@std/path/meta.json"));
        assertEquals("remote/https/example.com/b0836ab27fe53bf065811add774a642be51948f61fa86e93d12260925f8b3fcf", CachePaths.urlToCachePath("https://example.com/a?x=1"));
    }

    @Test
    public void testMissingPath() {
        String root = "remote/https/example.com/8a5edab282632443219e051e4ade2d1d5bbc671c781051bf1437897cbdfea0f1";
        assertEquals(root, CachePaths.urlToCachePath("https://example.com"));
        assertEquals(root, CachePaths.urlToCachePath("https://example.com/"));
    }

    @Test
    public void testFragmentIgnored() {
        String expected = "remote/https/h/00d74baf14ea415c6164614838c91f834c38c3e564444dfa5bc3aa0d2809e265";
        assertEquals(expected, CachePaths.urlToCachePath("https://h/p"));
        assertEquals(expected, CachePaths.urlToCachePath("https://h/p#a"));
        assertEquals(expected, CachePaths.urlToCachePath("https://h/p#b"));
        assertEquals(expected, CachePaths.urlToCachePath("https://h/p#"));
    }

    @Test
    public void testInsecureURLRejected() {
        assertThrows(InvalidInputException.class, () -> CachePaths.urlToCachePath("http://jsr.io/@std/path/meta.json"));
        assertThrows(InvalidInputException.class, () -> CachePaths.urlToCachePath("file:///etc/passwd"));
        assertThrows(InvalidInputException.class, () -> CachePaths.urlToCachePath("jsr.io/@std/path/meta.json"));
    }

    @Test
    public void testMediaTypes() {
        assertEquals("text/typescript", CachePaths.guessMediaType("/mod.ts"));
        assertEquals("text/typescript", CachePaths.guessMediaType("/component.tsx"));
        assertEquals("text/javascript", CachePaths.guessMediaType("/mod.js"));
        assertEquals("text/javascript", CachePaths.guessMediaType("/component.jsx"));
        assertEquals("text/javascript", CachePaths.guessMediaType("/esm.mjs"));
        assertEquals("application/json", CachePaths.guessMediaType("/deno.json"));
        assertEquals("application/wasm", CachePaths.guessMediaType("/lib.wasm"));
        assertEquals("text/plain", CachePaths.guessMediaType("/README.md"));
        assertEquals("text/plain", CachePaths.guessMediaType("/LICENSE"));
        assertEquals("text/plain", CachePaths.guessMediaType("/types.d.mts"));
    }
}
