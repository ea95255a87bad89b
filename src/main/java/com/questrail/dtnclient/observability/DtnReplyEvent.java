package com.questrail.dtnclient.observability;

import com.questrail.dtnclient.protocol.model.DtnMessage;

import java.time.Instant;

/**
 * A reply received from dtnd.
 *
 * @param encodedLength announced length of the reply body
 */
public record DtnReplyEvent(
    Instant timestamp,
    DtnMessage reply,
    int encodedLength
) {
}
