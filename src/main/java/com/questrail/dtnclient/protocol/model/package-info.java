/**
 * Application-Agent Message Model
 * =============================================================================
 *
 * <p>The closed set of messages exchanged with dtnd over its application-agent
 * socket. Requests and replies are separate sealed hierarchies
 * ({@link com.questrail.dtnclient.protocol.model.DtnRequest},
 * {@link com.questrail.dtnclient.protocol.model.DtnResponse}) so that illegal
 * flows, such as a request arriving as a reply, are visible in the types.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   DtnMessage
 *        → toMapping()           (this package)
 *            → MessageCodec      (protocol.codec)
 *                → byte[]
 *                    → LengthPrefixFraming
 * </pre>
 *
 * <p>Every variant validates its tag and required fields in its constructor.
 * This package has no knowledge of MessagePack, framing or sockets.</p>
 */
package com.questrail.dtnclient.protocol.model;
