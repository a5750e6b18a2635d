package org.stianloader.lockresolve.test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.stianloader.lockresolve.error.FetchFailedException;
import org.stianloader.lockresolve.repo.URIRegistryRepository;

import com.sun.net.httpserver.HttpServer;

public class URIRegistryRepositoryTest {

    private static final byte[] META = "{\"scope\": \"x\", \"name\": \"y\"}".getBytes(StandardCharsets.UTF_8);

    private HttpServer server;
    private URIRegistryRepository repository;

    @BeforeEach
    public void startServer() throws IOException {
        this.server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        this.server.createContext("/", (exchange) -> {
            if (exchange.getRequestURI().getPath().equals("/@x/y/meta.json")) {
                exchange.sendResponseHeaders(200, META.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(META);
                }
            } else {
                exchange.sendResponseHeaders(404, -1);
                exchange.close();
            }
        });
        this.server.start();
        this.repository = new URIRegistryRepository(URI.create("http://127.0.0.1:" + this.server.getAddress().getPort() + "/"))
                .setTimeouts(5_000, 5_000);
    }

    @AfterEach
    public void stopServer() {
        this.server.stop(0);
    }

    @Test
    public void testFetch() throws Exception {
        assertArrayEquals(META, this.repository.getResource("@x/y/meta.json", Runnable::run).get());
    }

    @Test
    public void testNotFound() {
        ExecutionException e = assertThrows(ExecutionException.class, () -> this.repository.getResource("@x/y/9.9.9_meta.json", Runnable::run).get());
        FetchFailedException cause = assertInstanceOf(FetchFailedException.class, e.getCause());
        assertEquals(404, cause.getStatus());
        assertEquals(this.repository.getPlaintextURL() + "/@x/y/9.9.9_meta.json", cause.getURL());
    }

    @Test
    public void testResourceURL() {
        URIRegistryRepository jsr = new URIRegistryRepository(URI.create("https://jsr.io/"));
        assertEquals("https://jsr.io", jsr.getPlaintextURL());
        assertEquals("https://jsr.io/@std/path/meta.json", jsr.getResourceURL("@std/path/meta.json"));
    }

    @Test
    public void testUnreachableHost() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 0, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }
        URIRegistryRepository closed = new URIRegistryRepository(URI.create("http://127.0.0.1:" + port)).setTimeouts(2_000, 2_000);
        ExecutionException e = assertThrows(ExecutionException.class, () -> closed.getResource("@x/y/meta.json", Runnable::run).get());
        FetchFailedException cause = assertInstanceOf(FetchFailedException.class, e.getCause());
        assertEquals(FetchFailedException.NO_STATUS, cause.getStatus());
    }
}
