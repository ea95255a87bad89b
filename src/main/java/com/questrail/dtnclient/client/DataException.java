package com.questrail.dtnclient.client;

/**
 * Indicates that data received from dtnd is inconsistent.
 *
 * This covers:
 * <ul>
 *   <li>A nonsensical or unsupported reply length prefix</li>
 *   <li>A reply shorter than its announced length</li>
 *   <li>A reply that is not a response message</li>
 *   <li>A response variant other than the one the operation expects</li>
 * </ul>
 */
public final class DataException extends RuntimeException
{
    public DataException(String message) {
        super(message);
    }
}
