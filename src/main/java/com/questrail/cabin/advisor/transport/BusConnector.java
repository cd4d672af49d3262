package com.questrail.cabin.advisor.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * BusConnector
 * -----------------------------------------------------------------------------
 * Establishes the initial bus connection with a bounded number of attempts and
 * a fixed pause between them.
 *
 * <p>Only startup is covered. Once connected, loss of the connection is
 * reported through {@link BusEndpointListener#onDisconnected(Throwable)}.</p>
 */
public final class BusConnector
{
    private static final Logger log = LoggerFactory.getLogger(BusConnector.class);

    /** Pause between attempts; replaced in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;

        Sleeper THREAD = d -> Thread.sleep(d.toMillis());
    }

    private final int maxAttempts;
    private final Duration backoff;
    private final Sleeper sleeper;

    public BusConnector(int maxAttempts, Duration backoff) {
        this(maxAttempts, backoff, Sleeper.THREAD);
    }

    public BusConnector(int maxAttempts, Duration backoff, Sleeper sleeper) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.maxAttempts = maxAttempts;
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Connects the endpoint, retrying on {@link BusConnectException}.
     *
     * @return the number of the attempt that succeeded, starting at 1
     * @throws BusConnectException when every attempt failed or the wait was interrupted
     */
    public int connect(BusEndpoint endpoint) {
        Objects.requireNonNull(endpoint, "endpoint");

        BusConnectException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                endpoint.connect();
                log.info("Connected to message bus (attempt {}/{})", attempt, maxAttempts);
                return attempt;
            } catch (BusConnectException e) {
                last = e;
                log.warn("Bus connection attempt {}/{} failed: {}", attempt, maxAttempts, e.getMessage());
            }

            if (attempt < maxAttempts) {
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new BusConnectException("Interrupted while waiting to reconnect", e);
                }
            }
        }
        throw new BusConnectException("Could not connect to message bus after " + maxAttempts + " attempts", last);
    }
}
