package com.questrail.cabin.advisor.transport;

/**
 * Indicates that the bus connection could not be established, either on a
 * single attempt or after all retries were exhausted.
 */
public final class BusConnectException extends RuntimeException
{
    public BusConnectException(String message) {
        super(message);
    }

    public BusConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
