package com.questrail.dtnclient.protocol.codec.impl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Saves the raw bytes of messages that could not be decoded, so malformed
 * wire data can be inspected after the fact.
 *
 * <p>Each failure produces one file named {@code dtnclient-undecodable-*.msgpack}
 * in the configured directory.</p>
 */
public final class DecodeFailureArchive
{
    private static final String PREFIX = "dtnclient-undecodable-";
    private static final String SUFFIX = ".msgpack";

    private final Path directory;

    public DecodeFailureArchive(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    /**
     * Archive in the JVM temporary directory.
     */
    public static DecodeFailureArchive inTempDirectory() {
        return new DecodeFailureArchive(Path.of(System.getProperty("java.io.tmpdir")));
    }

    public Path directory() {
        return directory;
    }

    /**
     * Writes {@code bytes} to a new file.
     *
     * @return path of the written file
     * @throws IOException if the directory cannot be created or written
     */
    public Path archive(byte[] bytes) throws IOException {
        Files.createDirectories(directory);
        Path file = Files.createTempFile(directory, PREFIX, SUFFIX);
        Files.write(file, bytes);
        return file;
    }
}
