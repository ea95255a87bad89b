package com.questrail.dtnclient.protocol.model;

/**
 * dtnd → client reply.
 *
 * <p>Every reply carries an error string. An empty string means the request
 * succeeded and any variant-specific payload is meaningful.</p>
 */
public sealed interface DtnResponse extends DtnMessage
        permits Response, BundleCreateResponse, ListResponse, FetchBundleResponse, FetchAllBundlesResponse
{
    /**
     * Returns the error reported by dtnd, or an empty string on success.
     */
    String error();

    /**
     * Returns {@code true} if dtnd reported an error.
     */
    default boolean isError() {
        return !error().isEmpty();
    }
}
