package com.questrail.dtnclient.transport;

import java.io.FileNotFoundException;

/**
 * Indicates that the configured daemon address does not resolve to a
 * reachable endpoint: the socket file is missing or nothing accepts
 * connections on it.
 */
public final class DaemonNotFoundException extends FileNotFoundException
{
    public DaemonNotFoundException(String message) {
        super(message);
    }

    public DaemonNotFoundException(String message, Throwable cause) {
        super(message);
        initCause(cause);
    }
}
