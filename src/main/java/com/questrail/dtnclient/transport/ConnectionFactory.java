package com.questrail.dtnclient.transport;

import java.io.IOException;

/**
 * Opens a fresh {@link Connection} to dtnd for each call.
 *
 * <p>Connections are never pooled or reused; the application-agent protocol
 * allows one request in flight per connection.</p>
 */
@FunctionalInterface
public interface ConnectionFactory
{
    /**
     * @return a newly opened connection
     * @throws DaemonNotFoundException if the daemon endpoint does not exist or refuses connections
     * @throws IOException             for any other transport failure
     */
    Connection open() throws IOException;
}
