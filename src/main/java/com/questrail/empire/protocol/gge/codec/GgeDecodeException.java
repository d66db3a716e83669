package com.questrail.empire.protocol.gge.codec;

/**
 * Indicates that an inbound text frame could not be translated into a
 * {@code GgeResponse}.
 *
 * This typically reflects:
 * <ul>
 *   <li>An XML frame that does not have the {@code <msg><body/></msg>} shape</li>
 *   <li>A delimited frame with fewer than four segments</li>
 *   <li>A non-numeric status segment</li>
 *   <li>A payload that starts like a JSON object but does not parse</li>
 * </ul>
 */
public final class GgeDecodeException extends RuntimeException
{
    public GgeDecodeException(String message) {
        super(message);
    }

    public GgeDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
