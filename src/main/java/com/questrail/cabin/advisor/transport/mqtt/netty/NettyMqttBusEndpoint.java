package com.questrail.cabin.advisor.transport.mqtt.netty;

import com.questrail.cabin.advisor.transport.BusConnectException;
import com.questrail.cabin.advisor.transport.BusEndpoint;
import com.questrail.cabin.advisor.transport.BusEndpointListener;
import com.questrail.cabin.advisor.transport.BusPublishException;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.mqtt.MqttDecoder;
import io.netty.handler.codec.mqtt.MqttEncoder;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * NettyMqttBusEndpoint
 * =============================================================================
 * Netty-backed MQTT 3.1.1 client implementing the {@link BusEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT decode
 * JSON, touch session state, or schedule advisor timers.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Inbound payloads are copied into
 * {@code byte[]} by {@link MqttClientHandler}.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #connect()} opens a TCP connection, sends CONNECT and blocks
 *       until CONNACK or the connect timeout.</li>
 *   <li>{@link #close()} sends DISCONNECT, closes the channel and shuts down
 *       the event loop group. The endpoint cannot be reused afterwards.</li>
 * </ul>
 */
public final class NettyMqttBusEndpoint implements BusEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyMqttBusEndpoint.class);

    /** Largest packet MQTT 3.1.1 can frame (remaining length of 268,435,455 bytes). */
    static final int MAX_MESSAGE_BYTES = 268_435_455;

    private final InetSocketAddress broker;
    private final String clientId;
    private final Duration keepAlive;
    private final Duration connectTimeout;

    private final EventLoopGroup group;
    private final AtomicInteger messageIds = new AtomicInteger();

    private volatile BusEndpointListener listener;
    private volatile Channel channel;
    private volatile boolean closed;

    public NettyMqttBusEndpoint(InetSocketAddress broker,
                                String clientId,
                                Duration keepAlive,
                                Duration connectTimeout)
    {
        this.broker = Objects.requireNonNull(broker, "broker");
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.keepAlive = Objects.requireNonNull(keepAlive, "keepAlive");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.group = new NioEventLoopGroup(1);
    }

    @Override
    public void setListener(BusEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void connect()
    {
        BusEndpointListener l = requireListener();
        if (closed) {
            throw new IllegalStateException("Endpoint is closed");
        }
        if (isConnected()) {
            return;
        }

        int keepAliveSeconds = (int) keepAlive.toSeconds();
        MqttClientHandler handler = new MqttClientHandler(clientId, keepAliveSeconds, l);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast("mqttDecoder", newDecoder());
                        p.addLast("mqttEncoder", MqttEncoder.INSTANCE);
                        p.addLast("keepAlive", new IdleStateHandler(0, keepAliveSeconds, 0));
                        p.addLast("mqttClient", handler);
                    }
                });

        ChannelFuture f = bootstrap.connect(broker);
        if (!f.awaitUninterruptibly(connectTimeout.toMillis())) {
            f.cancel(false);
            throw new BusConnectException("Timed out connecting to " + broker);
        }
        if (!f.isSuccess()) {
            throw new BusConnectException("Cannot reach broker " + broker, f.cause());
        }

        Channel ch = f.channel();
        try {
            handler.sessionFuture().get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ch.close();
            throw new BusConnectException("Interrupted during MQTT handshake", e);
        } catch (ExecutionException e) {
            ch.close();
            throw new BusConnectException("MQTT handshake with " + broker + " failed", e.getCause());
        } catch (TimeoutException e) {
            ch.close();
            throw new BusConnectException("No CONNACK from " + broker + " within " + connectTimeout, e);
        }
        channel = ch;
    }

    @Override
    public void subscribe(String topic)
    {
        Objects.requireNonNull(topic, "topic");
        Channel ch = requireChannel();
        ch.writeAndFlush(MqttMessages.subscribe(nextMessageId(), topic))
                .addListener(logFailure("subscribe to " + topic));
    }

    @Override
    public void publish(String topic, byte[] payload)
    {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            throw new BusPublishException("Not connected; cannot publish to " + topic);
        }
        ch.writeAndFlush(MqttMessages.publish(topic, payload))
                .addListener(logFailure("publish to " + topic));
    }

    @Override
    public boolean isConnected()
    {
        Channel ch = channel;
        return ch != null && ch.isActive();
    }

    @Override
    public void close()
    {
        if (closed) {
            return;
        }
        closed = true;

        Channel ch = channel;
        if (ch != null && ch.isActive()) {
            ch.writeAndFlush(MqttMessages.disconnect()).addListener(ChannelFutureListener.CLOSE);
            ch.closeFuture().awaitUninterruptibly(connectTimeout.toMillis());
        }
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    static MqttDecoder newDecoder()
    {
        return new MqttDecoder(MAX_MESSAGE_BYTES);
    }

    private int nextMessageId()
    {
        // MQTT packet identifiers are 1..65535.
        return messageIds.updateAndGet(id -> id >= 0xFFFF ? 1 : id + 1);
    }

    private Channel requireChannel()
    {
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            throw new IllegalStateException("Endpoint is not connected");
        }
        return ch;
    }

    private BusEndpointListener requireListener()
    {
        BusEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("BusEndpointListener must be set before connect()");
        }
        return l;
    }

    private static ChannelFutureListener logFailure(String what)
    {
        return future -> {
            if (!future.isSuccess()) {
                log.warn("Failed to {}", what, future.cause());
            }
        };
    }
}
