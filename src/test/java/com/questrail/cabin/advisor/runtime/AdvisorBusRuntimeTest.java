package com.questrail.cabin.advisor.runtime;

import com.questrail.cabin.advisor.codec.ActionEventDecoder;
import com.questrail.cabin.advisor.internal.events.ActionReceived;
import com.questrail.cabin.advisor.internal.events.AdvisorEvent;
import com.questrail.cabin.advisor.time.ManualWallClock;
import com.questrail.cabin.advisor.transport.BusConnectException;
import com.questrail.cabin.advisor.transport.BusConnector;
import com.questrail.cabin.advisor.transport.FakeBusEndpoint;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;

class AdvisorBusRuntimeTest {

    private final ManualWallClock wallClock = ManualWallClock.at(LocalDateTime.of(2024, 5, 1, 9, 0));
    private final FakeBusEndpoint endpoint = new FakeBusEndpoint();
    private final List<AdvisorEvent> inbound = new ArrayList<>();

    private final AdvisorBusRuntime runtime = new AdvisorBusRuntime(
            endpoint,
            new BusConnector(3, Duration.ZERO, d -> {}),
            new ActionEventDecoder(wallClock),
            "vehicle/actions",
            wallClock,
            inbound::add);

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void startConnectsThenSubscribes() {
        endpoint.failNextConnects(2);

        runtime.start();

        assertEquals(3, endpoint.connectCalls());
        assertEquals(List.of("vehicle/actions"), endpoint.subscriptions());
    }

    @Test
    void startFailsWhenBrokerNeverAnswers() {
        endpoint.failNextConnects(5);

        assertThrows(BusConnectException.class, runtime::start);
        assertTrue(endpoint.subscriptions().isEmpty());
    }

    @Test
    void validActionIsForwarded() {
        runtime.start();

        endpoint.inject("vehicle/actions", utf8("{\"action\":\"infotainment_set_volume\",\"value\":35}"));

        assertEquals(1, inbound.size());
        ActionReceived received = assertInstanceOf(ActionReceived.class, inbound.get(0));
        assertEquals("infotainment_set_volume", received.action().action());
        assertEquals(35.0, received.action().value());
        assertEquals(wallClock.now(), received.action().timestamp());
        assertEquals(wallClock.now(), received.timestamp());
    }

    @Test
    void malformedPayloadIsDropped() {
        runtime.start();

        endpoint.inject("vehicle/actions", utf8("not json"));
        endpoint.inject("vehicle/actions", utf8("{\"value\":3}"));

        assertTrue(inbound.isEmpty());
    }

    @Test
    void otherTopicsAreIgnored() {
        runtime.start();

        endpoint.inject("vehicle/recommendations", utf8("{\"action\":\"lights_dim\"}"));

        assertTrue(inbound.isEmpty());
    }

    @Test
    void stopClosesEndpoint() {
        runtime.start();
        runtime.stop();

        assertTrue(endpoint.isClosed());
        assertFalse(endpoint.isConnected());
    }

    private AdvisorBusRuntime runtimeWith(Executor reconnectExecutor) {
        return new AdvisorBusRuntime(
                endpoint,
                new BusConnector(3, Duration.ZERO, d -> {}),
                new ActionEventDecoder(wallClock),
                "vehicle/actions",
                wallClock,
                inbound::add,
                reconnectExecutor);
    }

    @Test
    void lostConnectionIsRestoredAndResubscribed() {
        AdvisorBusRuntime direct = runtimeWith(Runnable::run);
        direct.start();

        endpoint.dropConnection(new IOException("connection reset"));

        assertTrue(endpoint.isConnected());
        assertEquals(2, endpoint.connectCalls());
        assertEquals(List.of("vehicle/actions", "vehicle/actions"), endpoint.subscriptions());

        endpoint.inject("vehicle/actions", utf8("{\"action\":\"lights_dim\"}"));
        assertEquals(1, inbound.size());
    }

    @Test
    void reconnectKeepsTryingAcrossRounds() {
        AdvisorBusRuntime direct = runtimeWith(Runnable::run);
        direct.start();
        endpoint.failNextConnects(4);

        endpoint.dropConnection(null);

        assertTrue(endpoint.isConnected());
        assertEquals(1 + 5, endpoint.connectCalls(), "one failed round of three, then success on the second attempt");
        assertEquals(2, endpoint.subscriptions().size());
    }

    @Test
    void reconnectRunsOnTheSuppliedExecutor() {
        List<Runnable> queued = new ArrayList<>();
        AdvisorBusRuntime deferred = runtimeWith(queued::add);
        deferred.start();

        endpoint.dropConnection(null);

        assertFalse(endpoint.isConnected(), "nothing reconnects on the transport callback");
        assertEquals(1, queued.size());

        queued.get(0).run();
        assertTrue(endpoint.isConnected());
        assertEquals(2, endpoint.subscriptions().size());
    }

    @Test
    void stopDoesNotTriggerReconnect() {
        List<Runnable> queued = new ArrayList<>();
        AdvisorBusRuntime deferred = runtimeWith(queued::add);
        deferred.start();

        deferred.stop();

        assertTrue(queued.isEmpty());
        assertEquals(1, endpoint.connectCalls());
    }
}
