package com.questrail.cabin.advisor.runtime;

import com.questrail.cabin.advisor.codec.ActionDecodeException;
import com.questrail.cabin.advisor.codec.ActionEventDecoder;
import com.questrail.cabin.advisor.internal.events.ActionReceived;
import com.questrail.cabin.advisor.internal.events.AdvisorEvent;
import com.questrail.cabin.advisor.internal.time.WallClock;
import com.questrail.cabin.advisor.transport.BusConnectException;
import com.questrail.cabin.advisor.transport.BusConnector;
import com.questrail.cabin.advisor.transport.BusEndpoint;
import com.questrail.cabin.advisor.transport.BusEndpointListener;
import com.questrail.cabin.api.ActionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * AdvisorBusRuntime
 * =============================================================================
 * Wiring between the bus endpoint and the session's inbound event queue.
 *
 * <h2>Inbound Data Flow</h2>
 * <pre>
 *   BusEndpoint (vehicle/actions)
 *        → ActionEventDecoder
 *            → ActionReceived
 *                → session event queue
 * </pre>
 *
 * <p>Malformed payloads are logged and dropped here; they never reach the
 * session. Messages on other topics are ignored.</p>
 *
 * <p>No session semantics live here. Callbacks run on the transport's thread
 * and only enqueue.</p>
 *
 * <h2>Reconnection</h2>
 * A connection lost after startup is re-established on the reconnect
 * executor, never on the transport thread: connect through the
 * {@link BusConnector}, then subscribe to the actions topic again. Rounds
 * repeat until a connection succeeds or {@link #stop()} is called.
 */
public final class AdvisorBusRuntime
{
    private static final Logger log = LoggerFactory.getLogger(AdvisorBusRuntime.class);

    private final BusEndpoint endpoint;
    private final BusConnector connector;
    private final ActionEventDecoder decoder;
    private final String actionsTopic;
    private final WallClock wallClock;
    private final Consumer<AdvisorEvent> inbound;
    private final Executor reconnectExecutor;
    private final ExecutorService ownedExecutor;

    private volatile boolean stopped;

    public AdvisorBusRuntime(BusEndpoint endpoint,
                             BusConnector connector,
                             ActionEventDecoder decoder,
                             String actionsTopic,
                             WallClock wallClock,
                             Consumer<AdvisorEvent> inbound)
    {
        this(endpoint, connector, decoder, actionsTopic, wallClock, inbound, null);
    }

    /**
     * @param reconnectExecutor runs reconnection rounds; {@code null} for a
     *                          dedicated daemon thread owned by this runtime
     */
    public AdvisorBusRuntime(BusEndpoint endpoint,
                             BusConnector connector,
                             ActionEventDecoder decoder,
                             String actionsTopic,
                             WallClock wallClock,
                             Consumer<AdvisorEvent> inbound,
                             Executor reconnectExecutor)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.actionsTopic = Objects.requireNonNull(actionsTopic, "actionsTopic");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.inbound = Objects.requireNonNull(inbound, "inbound");
        if (reconnectExecutor != null) {
            this.ownedExecutor = null;
            this.reconnectExecutor = reconnectExecutor;
        } else {
            this.ownedExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "cabin-advisor-reconnect");
                t.setDaemon(true);
                return t;
            });
            this.reconnectExecutor = ownedExecutor;
        }

        this.endpoint.setListener(new Listener());
    }

    /**
     * Connects with retry, then subscribes to the actions topic.
     *
     * @throws com.questrail.cabin.advisor.transport.BusConnectException if no attempt succeeded
     */
    public void start() {
        connector.connect(endpoint);
        endpoint.subscribe(actionsTopic);
        log.info("Subscribed to {}", actionsTopic);
    }

    public void stop() {
        stopped = true;
        endpoint.close();
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    private void reconnect() {
        while (!stopped && !Thread.currentThread().isInterrupted()) {
            try {
                int attempts = connector.connect(endpoint);
                endpoint.subscribe(actionsTopic);
                log.info("Reconnected to message bus after {} attempt(s); resubscribed to {}", attempts, actionsTopic);
                return;
            } catch (BusConnectException e) {
                log.error("Reconnection round failed, starting another: {}", e.getMessage());
            }
        }
    }

    // -------------------------------------------------------------------------
    // Transport Listener
    // -------------------------------------------------------------------------

    private final class Listener implements BusEndpointListener {
        @Override
        public void onConnected() {
            log.debug("Bus session established");
        }

        @Override
        public void onDisconnected(Throwable cause) {
            if (stopped) {
                log.info("Bus connection closed");
                return;
            }
            if (cause != null) {
                log.warn("Bus connection lost, reconnecting", cause);
            } else {
                log.warn("Bus connection closed by broker, reconnecting");
            }
            reconnectExecutor.execute(AdvisorBusRuntime.this::reconnect);
        }

        @Override
        public void onMessage(String topic, byte[] payload) {
            if (!actionsTopic.equals(topic)) {
                log.debug("Ignoring message on {}", topic);
                return;
            }

            final ActionEvent action;
            try {
                action = decoder.decode(payload);
            } catch (ActionDecodeException e) {
                log.warn("Discarding malformed action payload: {}", e.getMessage());
                return;
            }
            inbound.accept(new ActionReceived(wallClock.now(), action));
        }
    }
}
