/**
 * Advisor Transport Ports
 * =============================================================================
 *
 * <p>Framework-agnostic boundary between a concrete bus client (Netty MQTT or a
 * test double) and the advisor runtime. Everything above this package sees
 * only topic names, raw {@code byte[]} payloads and connection lifecycle
 * callbacks.</p>
 *
 * <h2>Constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only</li>
 *   <li>Not decode JSON or touch session state</li>
 *   <li>Not schedule recommendation or reminder timers</li>
 * </ul>
 */
package com.questrail.cabin.advisor.transport;
