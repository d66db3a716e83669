package com.questrail.empire.protocol.gge.engine;

/**
 * A reply arrived but says the step failed: a non-zero handshake status, an
 * unexpected login status, or a transport that never opened.
 *
 * <p>Thrown inside a connect attempt; the connection turns it into a login retry.</p>
 */
public final class GgeProtocolException extends RuntimeException
{
    public GgeProtocolException(String message) {
        super(message);
    }
}
