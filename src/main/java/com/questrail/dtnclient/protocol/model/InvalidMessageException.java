package com.questrail.dtnclient.protocol.model;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Indicates that a message violates its structural invariants.
 *
 * This covers:
 * <ul>
 *   <li>A variant constructed with a tag other than its own discriminant</li>
 *   <li>A missing, empty or mistyped required field</li>
 *   <li>A wire payload without a discriminant, or with one that is unknown
 *       or has no registered decoder</li>
 * </ul>
 *
 * <p>When raised while decoding wire bytes, the raw bytes are archived and
 * {@link #rawMessagePath()} points at the archived copy.</p>
 */
public final class InvalidMessageException extends RuntimeException
{
    private final Path rawMessagePath;

    public InvalidMessageException(String message) {
        this(message, null, null);
    }

    public InvalidMessageException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public InvalidMessageException(String message, Throwable cause, Path rawMessagePath) {
        super(message, cause);
        this.rawMessagePath = rawMessagePath;
    }

    /**
     * Returns where the undecodable bytes were saved, if this exception was
     * raised by a decoder that archived them.
     */
    public Optional<Path> rawMessagePath() {
        return Optional.ofNullable(rawMessagePath);
    }
}
