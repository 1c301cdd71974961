package com.questrail.qotd.host;

/**
 * Thrown when a request is issued against a server or client that is shutting
 * down or already closed.
 */
public final class HostDisposedException extends IllegalStateException
{
    public HostDisposedException(String hostName) {
        super(hostName + " is disposed");
    }
}
