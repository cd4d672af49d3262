package com.questrail.cabin.advisor.transport.mqtt.netty;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.mqtt.MqttConnectMessage;
import io.netty.handler.codec.mqtt.MqttFixedHeader;
import io.netty.handler.codec.mqtt.MqttMessage;
import io.netty.handler.codec.mqtt.MqttMessageBuilders;
import io.netty.handler.codec.mqtt.MqttMessageType;
import io.netty.handler.codec.mqtt.MqttPublishMessage;
import io.netty.handler.codec.mqtt.MqttQoS;
import io.netty.handler.codec.mqtt.MqttSubscribeMessage;
import io.netty.handler.codec.mqtt.MqttVersion;

/**
 * Factories for the MQTT 3.1.1 control packets the advisor sends.
 *
 * <p>All traffic is QoS 0, so no acknowledgement bookkeeping is needed for
 * publishes.</p>
 */
final class MqttMessages
{
    private MqttMessages() {
    }

    static MqttConnectMessage connect(String clientId, int keepAliveSeconds) {
        return MqttMessageBuilders.connect()
                .protocolVersion(MqttVersion.MQTT_3_1_1)
                .clientId(clientId)
                .keepAlive(keepAliveSeconds)
                .cleanSession(true)
                .build();
    }

    static MqttSubscribeMessage subscribe(int messageId, String topic) {
        return MqttMessageBuilders.subscribe()
                .messageId(messageId)
                .addSubscription(MqttQoS.AT_MOST_ONCE, topic)
                .build();
    }

    static MqttPublishMessage publish(String topic, byte[] payload) {
        return MqttMessageBuilders.publish()
                .topicName(topic)
                .qos(MqttQoS.AT_MOST_ONCE)
                .retained(false)
                .messageId(0)
                .payload(Unpooled.wrappedBuffer(payload))
                .build();
    }

    static MqttMessage pingReq() {
        return control(MqttMessageType.PINGREQ);
    }

    static MqttMessage disconnect() {
        return control(MqttMessageType.DISCONNECT);
    }

    private static MqttMessage control(MqttMessageType type) {
        return new MqttMessage(new MqttFixedHeader(type, false, MqttQoS.AT_MOST_ONCE, false, 0));
    }
}
