package com.questrail.dtnclient.observability;

/**
 * Main interface for receiving observability events from the dtnd client.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface DtnClientObservabilitySink {
    /**
     * Called after a request has been encoded, before it is written.
     * @param event the request details
     */
    void onRequestSent(DtnRequestEvent event);

    /**
     * Called after a reply has been read and decoded.
     * @param event the reply details
     */
    void onReplyReceived(DtnReplyEvent event);

    /**
     * Called when a call fails, just before the failure propagates to the caller.
     * @param event the error event
     */
    void onError(DtnErrorEvent event);
}
