package com.questrail.dtnclient.client;

/**
 * Indicates that dtnd answered with a well-formed reply whose error field
 * was set.
 */
public final class DtndException extends RuntimeException
{
    private final String daemonError;

    public DtndException(String daemonError) {
        super(daemonError);
        this.daemonError = daemonError;
    }

    /**
     * Returns the error text exactly as dtnd reported it.
     */
    public String daemonError() {
        return daemonError;
    }
}
