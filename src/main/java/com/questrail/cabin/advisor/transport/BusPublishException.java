package com.questrail.cabin.advisor.transport;

/**
 * Indicates that an outbound message could not be handed to the bus.
 */
public final class BusPublishException extends RuntimeException
{
    public BusPublishException(String message) {
        super(message);
    }

    public BusPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
