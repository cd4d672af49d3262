package com.questrail.cabin.advisor.transport;

/**
 * BusEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a topic-based publish/subscribe bus.
 *
 * <p>Higher layers are responsible for:</p>
 * <ul>
 *   <li>decoding inbound payloads and submitting them to the session</li>
 *   <li>encoding outbound recommendation batches</li>
 *   <li>retrying the initial connection</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty or a test harness.</p>
 */
public interface BusEndpoint
{
    /**
     * Register the listener that receives inbound messages and lifecycle events.
     *
     * <p>This must be called before {@link #connect()}.</p>
     */
    void setListener(BusEndpointListener listener);

    /**
     * Open the connection and wait until the broker accepts the session.
     *
     * @throws BusConnectException if the broker cannot be reached or refuses the session
     */
    void connect();

    /**
     * Subscribe to a topic. Messages are delivered to
     * {@link BusEndpointListener#onMessage(String, byte[])}.
     */
    void subscribe(String topic);

    /**
     * Publish a payload to a topic. The write itself is asynchronous.
     *
     * @throws BusPublishException if the endpoint is not connected
     */
    void publish(String topic, byte[] payload);

    boolean isConnected();

    /**
     * Close the connection and release all transport resources.
     */
    void close();
}
