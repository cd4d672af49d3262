package com.questrail.cabin.advisor.transport.mqtt.netty;

import com.questrail.cabin.advisor.transport.BusConnectException;
import com.questrail.cabin.advisor.transport.BusEndpointListener;

import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.mqtt.MqttConnAckMessage;
import io.netty.handler.codec.mqtt.MqttConnectReturnCode;
import io.netty.handler.codec.mqtt.MqttMessage;
import io.netty.handler.codec.mqtt.MqttPublishMessage;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * MqttClientHandler
 * -----------------------------------------------------------------------------
 * Client side of one MQTT session on one channel.
 *
 * <ul>
 *   <li>Sends CONNECT when the channel becomes active and completes
 *       {@link #sessionFuture()} on CONNACK.</li>
 *   <li>Copies PUBLISH payloads into {@code byte[]} and hands them to the
 *       listener; all buffers are released here.</li>
 *   <li>Sends PINGREQ whenever the writer has been idle for the keep-alive.</li>
 * </ul>
 *
 * <p>The listener only hears {@code onDisconnected} for a session that was
 * accepted. A failed handshake completes the session future exceptionally
 * instead.</p>
 */
final class MqttClientHandler extends ChannelInboundHandlerAdapter
{
    private static final Logger log = LoggerFactory.getLogger(MqttClientHandler.class);

    private final String clientId;
    private final int keepAliveSeconds;
    private final BusEndpointListener listener;
    private final CompletableFuture<Void> sessionFuture = new CompletableFuture<>();
    private boolean disconnectReported;

    MqttClientHandler(String clientId, int keepAliveSeconds, BusEndpointListener listener) {
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.keepAliveSeconds = keepAliveSeconds;
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    CompletableFuture<Void> sessionFuture() {
        return sessionFuture;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        ctx.writeAndFlush(MqttMessages.connect(clientId, keepAliveSeconds));
        super.channelActive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        try {
            if (!(msg instanceof MqttMessage message)) {
                return;
            }
            if (message.decoderResult().isFailure()) {
                exceptionCaught(ctx, new DecoderException("Malformed MQTT packet", message.decoderResult().cause()));
                return;
            }
            switch (message.fixedHeader().messageType()) {
                case CONNACK -> onConnAck(ctx, (MqttConnAckMessage) message);
                case PUBLISH -> onPublish((MqttPublishMessage) message);
                case SUBACK -> log.debug("Subscription acknowledged");
                case PINGRESP -> log.trace("PINGRESP");
                default -> log.debug("Ignoring MQTT {}", message.fixedHeader().messageType());
            }
        } finally {
            ReferenceCountUtil.release(msg);
        }
    }

    private void onConnAck(ChannelHandlerContext ctx, MqttConnAckMessage ack) {
        MqttConnectReturnCode code = ack.variableHeader().connectReturnCode();
        if (code == MqttConnectReturnCode.CONNECTION_ACCEPTED) {
            if (sessionFuture.complete(null)) {
                listener.onConnected();
            }
        } else {
            sessionFuture.completeExceptionally(new BusConnectException("Broker refused connection: " + code));
            ctx.close();
        }
    }

    private void onPublish(MqttPublishMessage publish) {
        String topic = publish.variableHeader().topicName();
        byte[] payload = ByteBufUtil.getBytes(publish.payload());
        listener.onMessage(topic, payload);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent idle && idle.state() == IdleState.WRITER_IDLE) {
            ctx.writeAndFlush(MqttMessages.pingReq());
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        sessionEnded(new BusConnectException("Connection closed before CONNACK"), null);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        sessionEnded(cause, cause);
        ctx.close();
    }

    // Runs on the event loop; reports at most one disconnect per accepted session.
    private void sessionEnded(Throwable handshakeFailure, Throwable cause) {
        if (!sessionFuture.isDone()) {
            sessionFuture.completeExceptionally(handshakeFailure);
            return;
        }
        if (!sessionFuture.isCompletedExceptionally() && !disconnectReported) {
            disconnectReported = true;
            listener.onDisconnected(cause);
        }
    }
}
