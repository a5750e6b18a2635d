package org.stianloader.lockresolve.internal;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.lockresolve.logging.LoggingAdapter;

/**
 * Durable, atomic file replacement. Contents are written to a {@code .part} file next to the target,
 * flushed to disk and then moved over the target, so that readers observe either the old or the new
 * contents but never a truncated file. Concurrent writers of the same target are serialized through a
 * {@code .part.lock} file.
 */
public final class AtomicFiles {

    private AtomicFiles() {
        throw new UnsupportedOperationException("Static utility class");
    }

    public static void writeString(@NotNull Path to, @NotNull String contents) throws IOException {
        AtomicFiles.write(to, contents.getBytes(StandardCharsets.UTF_8));
    }

    public static void write(@NotNull Path to, byte @NotNull[] data) throws IOException {
        to = to.toAbsolutePath();
        Path parent = to.getParent();
        if (parent != null && Files.notExists(parent)) {
            Files.createDirectories(parent);
        }

        Path parts = to.resolveSibling(to.getFileName().toString() + ".part");
        Path lock = to.resolveSibling(to.getFileName().toString() + ".part.lock");

        try (FileChannel lockChannel = FileChannel.open(lock, StandardOpenOption.WRITE, StandardOpenOption.CREATE, StandardOpenOption.DELETE_ON_CLOSE)) {
            FileLock fileLock = AtomicFiles.acquire(lockChannel, parts);
            try {
                Set<PosixFilePermission> permissions = AtomicFiles.getPermissions(to);
                try (FileChannel channel = FileChannel.open(parts, StandardOpenOption.WRITE, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                    ByteBuffer buffer = ByteBuffer.wrap(data);
                    while (buffer.hasRemaining()) {
                        channel.write(buffer);
                    }
                    channel.force(true);
                }
                if (permissions != null) {
                    Files.setPosixFilePermissions(parts, permissions);
                }

                try {
                    Files.move(parts, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    LoggingAdapter.getDefaultLogger().warn(AtomicFiles.class, "Atomic moves are not supported for {}, falling back to a plain replace", to);
                    Files.move(parts, to, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(parts);
                fileLock.release();
            }
        }
    }

    @NotNull
    private static FileLock acquire(@NotNull FileChannel lockChannel, @NotNull Path parts) throws IOException {
        FileLock fileLock;
        long idleTime = 0L;
        while ((fileLock = lockChannel.tryLock()) == null) {
            try {
                Thread.sleep(10L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while waiting for the lock on " + parts, e);
            }
            if ((idleTime += 10L) > 10_000L) {
                throw new IOException("Waited more than 10 seconds to acquire lock on " + parts);
            }
        }
        return fileLock;
    }

    @Nullable
    private static Set<PosixFilePermission> getPermissions(@NotNull Path file) throws IOException {
        if (!Files.exists(file) || Files.getFileAttributeView(file, PosixFileAttributeView.class) == null) {
            return null;
        }
        return Files.getPosixFilePermissions(file);
    }
}
