package com.questrail.dtnclient.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of DtnClientObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jDtnClientObservabilitySink implements DtnClientObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDtnClientObservabilitySink.class);

    @Override
    public void onRequestSent(DtnRequestEvent event) {
        log.debug("Sending message: {}", event.request());
        log.debug("Message length: {}", event.encodedLength());
    }

    @Override
    public void onReplyReceived(DtnReplyEvent event) {
        log.debug("Reply length: {}", event.encodedLength());
        log.debug("Received reply: {}", event.reply());
    }

    @Override
    public void onError(DtnErrorEvent event) {
        log.warn("Call to dtnd failed: {}", event.message());
        log.debug("Failure detail", event.cause());
    }
}
