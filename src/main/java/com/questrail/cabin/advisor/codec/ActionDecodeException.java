package com.questrail.cabin.advisor.codec;

/**
 * Indicates that an inbound action payload could not be turned into an
 * {@link com.questrail.cabin.api.ActionEvent}.
 *
 * This typically reflects:
 * <ul>
 *   <li>Bytes that are not a JSON object</li>
 *   <li>A missing or blank {@code action} field</li>
 *   <li>A {@code timestamp} that is not ISO-8601</li>
 *   <li>A {@code value} that is neither a number nor null</li>
 * </ul>
 */
public final class ActionDecodeException extends RuntimeException
{
    public ActionDecodeException(String message) {
        super(message);
    }

    public ActionDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
