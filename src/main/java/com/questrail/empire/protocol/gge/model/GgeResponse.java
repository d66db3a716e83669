package com.questrail.empire.protocol.gge.model;

/**
 * One decoded inbound frame.
 *
 * <p>
 * The server speaks two formats over the same stream: XML frames during the
 * handshake ({@link XmlResponse}) and {@code %}-delimited command frames once the
 * zone is joined ({@link DelimitedResponse}). Correlation only ever compares a
 * pending request against a frame of its own kind.
 * </p>
 */
public sealed interface GgeResponse permits DelimitedResponse, XmlResponse {
}
