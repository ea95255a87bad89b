package com.questrail.dtnclient.eid;

/**
 * Indicates that a piece of text is not a valid bundle-protocol endpoint
 * identifier.
 *
 * <p>Raised exclusively while parsing or constructing an {@link EndpointId};
 * an {@code EndpointId} instance that exists is always valid.</p>
 */
public final class EidException extends IllegalArgumentException
{
    public EidException(String message) {
        super(message);
    }

    public EidException(String message, Throwable cause) {
        super(message, cause);
    }
}
