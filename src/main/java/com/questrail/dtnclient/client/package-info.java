/**
 * Framed Transport Call
 * =============================================================================
 *
 * <p>The one-shot request/reply exchange with dtnd and the typed operations
 * built on it.</p>
 *
 * <h2>Wire framing</h2>
 * <pre>
 *   [8 bytes: message length, unsigned big-endian][N bytes: encoded message]
 * </pre>
 * <p>Identical for request and reply. Exactly one request is in flight per
 * connection, and every call opens and closes its own connection.</p>
 */
package com.questrail.dtnclient.client;
