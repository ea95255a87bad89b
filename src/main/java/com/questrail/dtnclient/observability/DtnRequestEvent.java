package com.questrail.dtnclient.observability;

import com.questrail.dtnclient.protocol.model.DtnMessage;

import java.time.Instant;

/**
 * A request about to be sent to dtnd.
 *
 * @param encodedLength length of the encoded body, excluding the length prefix
 */
public record DtnRequestEvent(
    Instant timestamp,
    DtnMessage request,
    int encodedLength
) {
}
