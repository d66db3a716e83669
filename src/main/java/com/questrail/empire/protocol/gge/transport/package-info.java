/**
 * Game-server transport ports
 * =============================================================================
 *
 * These interfaces are the boundary between the protocol engine and a concrete
 * networking implementation (Netty WebSocket, Netty TCP, or a test double).
 *
 * <h2>What crosses the boundary</h2>
 * <ul>
 *   <li>Complete text messages as {@link java.lang.String}</li>
 *   <li>Open, error and close notifications</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only: no frame decoding and no correlation</li>
 *   <li>Not schedule reconnects, heartbeats or timeouts</li>
 *   <li>Keep Netty types inside {@code transport.netty}</li>
 * </ul>
 */
package com.questrail.empire.protocol.gge.transport;
