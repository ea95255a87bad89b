package com.questrail.dtnclient.eid;

/**
 * Group endpoints used by the reference deployment of dtnd.
 */
public final class WellKnownEndpoints
{
    public static final EndpointId BROADCAST_ADDRESS = EndpointId.dtn("rec.all", "~");
    public static final EndpointId BROKER_MULTICAST_ADDRESS = EndpointId.dtn("rec.broker", "~");
    public static final EndpointId DATASTORE_MULTICAST_ADDRESS = EndpointId.dtn("rec.store", "~");
    public static final EndpointId EXECUTOR_MULTICAST_ADDRESS = EndpointId.dtn("rec.executor", "~");
    public static final EndpointId CLIENT_MULTICAST_ADDRESS = EndpointId.dtn("rec.client", "~");

    private WellKnownEndpoints() {}
}
