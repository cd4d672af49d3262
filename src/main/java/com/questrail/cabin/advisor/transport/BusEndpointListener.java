package com.questrail.cabin.advisor.transport;

/**
 * BusEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link BusEndpoint}.
 *
 * <p>Callbacks are serialized by the endpoint. Netty endpoints deliver them on
 * the channel's event loop, so implementations must not block.</p>
 */
public interface BusEndpointListener
{
    /**
     * Called once the broker accepted the session.
     */
    void onConnected();

    /**
     * Called when the connection becomes unusable.
     *
     * @param cause failure cause; {@code null} for an orderly close
     */
    void onDisconnected(Throwable cause);

    /**
     * Called for every message received on a subscribed topic. The payload is
     * a private copy owned by the listener.
     */
    void onMessage(String topic, byte[] payload);
}
