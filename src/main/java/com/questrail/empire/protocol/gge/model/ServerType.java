package com.questrail.empire.protocol.gge.model;

/**
 * Game variant a zone belongs to.
 *
 * <p>The variant selects the login sequence and shows up in every log line so
 * that zones with the same name on different variants stay distinguishable.</p>
 */
public enum ServerType {
    /** Empire (browser); single realm login with {@code lli}. */
    EP,
    /** Empire: Four Kingdoms; {@code core_lga} login with self-registration. */
    E4K,
    /** Temporary event server joined with a one-off token. */
    LIVE
}
