package com.questrail.dtnclient.protocol.model;

/**
 * Client → dtnd request.
 */
public sealed interface DtnRequest extends DtnMessage
        permits RegisterUnregister, BundleCreate, ListBundles, FetchBundle, FetchAllBundles
{
}
