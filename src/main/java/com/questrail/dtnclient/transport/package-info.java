/**
 * Application-Agent Transport Ports
 * =============================================================================
 *
 * <p>These interfaces define the boundary between a concrete stream transport
 * (Unix domain socket, TCP, or a test double) and the framed call.</p>
 *
 * <h2>Architectural constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform byte I/O only (no framing, no message interpretation)</li>
 *   <li>Open a new connection per call and never pool or reuse one</li>
 *   <li>Not retry failed connects, reads or writes</li>
 * </ul>
 *
 * <p>A caller-supplied deadline is the only cancellation mechanism; its expiry
 * surfaces as {@link java.net.SocketTimeoutException}, a transport failure,
 * never as a protocol error.</p>
 */
package com.questrail.dtnclient.transport;
