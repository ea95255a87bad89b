package com.questrail.dtnclient.observability;

/**
 * No-op implementation of DtnClientObservabilitySink.
 */
public final class NullObservabilitySink implements DtnClientObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onRequestSent(DtnRequestEvent event) {}

    @Override
    public void onReplyReceived(DtnReplyEvent event) {}

    @Override
    public void onError(DtnErrorEvent event) {}
}
