/**
 * Netty MQTT client behind the {@link com.questrail.cabin.advisor.transport.BusEndpoint} port.
 *
 * <p>Netty types stay inside this package.</p>
 */
package com.questrail.cabin.advisor.transport.mqtt.netty;
