package com.questrail.cabin.advisor.transport.mqtt.netty;

import com.questrail.cabin.advisor.transport.BusConnectException;
import com.questrail.cabin.advisor.transport.BusEndpointListener;
import com.questrail.cabin.advisor.transport.BusPublishException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class NettyMqttBusEndpointTest {

    private static final BusEndpointListener NOOP = new BusEndpointListener() {
        @Override
        public void onConnected() {}

        @Override
        public void onDisconnected(Throwable cause) {}

        @Override
        public void onMessage(String topic, byte[] payload) {}
    };

    private NettyMqttBusEndpoint endpoint;

    @AfterEach
    void tearDown() {
        if (endpoint != null) {
            endpoint.close();
        }
    }

    private static int unusedPort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            return socket.getLocalPort();
        }
    }

    @Test
    void connectRequiresListener() {
        endpoint = new NettyMqttBusEndpoint(new InetSocketAddress("127.0.0.1", 1883), "c", Duration.ofSeconds(60), Duration.ofSeconds(1));
        assertThrows(IllegalStateException.class, endpoint::connect);
    }

    @Test
    void unreachableBrokerFailsConnect() throws IOException {
        endpoint = new NettyMqttBusEndpoint(
                new InetSocketAddress(InetAddress.getLoopbackAddress(), unusedPort()),
                "c", Duration.ofSeconds(60), Duration.ofSeconds(2));
        endpoint.setListener(NOOP);

        assertThrows(BusConnectException.class, endpoint::connect);
        assertFalse(endpoint.isConnected());
    }

    @Test
    void publishBeforeConnectIsRejected() {
        endpoint = new NettyMqttBusEndpoint(new InetSocketAddress("127.0.0.1", 1883), "c", Duration.ofSeconds(60), Duration.ofSeconds(1));
        endpoint.setListener(NOOP);

        assertThrows(BusPublishException.class, () -> endpoint.publish("vehicle/recommendations", new byte[] {1}));
    }
}
