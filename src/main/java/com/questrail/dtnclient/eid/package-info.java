/**
 * Endpoint Identifiers
 * =============================================================================
 *
 * <p>Parsing, normalization and validation of bundle-protocol endpoint
 * identifiers in the {@code dtn:} and {@code ipn:} URI schemes.</p>
 *
 * <p>Every message exchanged with dtnd references at least one endpoint. The
 * canonical text produced here is what goes onto the wire, so it must
 * round-trip byte-for-byte through serialization.</p>
 */
package com.questrail.dtnclient.eid;
