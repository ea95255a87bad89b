package com.questrail.dtnclient.protocol.model;

import java.util.Map;

/**
 * Canonical semantic representation of a message exchanged with dtnd.
 *
 * <h2>Directionality</h2>
 * <p>The application-agent protocol is strictly request/response:</p>
 * <ul>
 *   <li>Client → dtnd messages are {@link DtnRequest}s</li>
 *   <li>dtnd → client messages are {@link DtnResponse}s</li>
 * </ul>
 *
 * <h2>Invariants</h2>
 * <p>Every variant validates its tag and required fields in its constructor.
 * An instance that exists is always structurally valid; nothing is deferred to
 * encoding time.</p>
 *
 * <h2>Mapping</h2>
 * <p>{@link #toMapping()} produces the generic key/value form the wire codec
 * serializes. Endpoint identifiers appear in it as their canonical text. The
 * reverse direction is a static {@code fromMapping} on each variant, looked up
 * through the codec's discriminant registry.</p>
 */
public sealed interface DtnMessage
        permits DtnRequest, DtnResponse
{
    /**
     * Returns the discriminant of this message.
     */
    MessageType type();

    /**
     * Returns the ordered field mapping of this message, keyed by wire field
     * name. Base fields come first, followed by variant fields.
     *
     * @return a fresh, mutable, insertion-ordered map
     */
    Map<String, Object> toMapping();
}
