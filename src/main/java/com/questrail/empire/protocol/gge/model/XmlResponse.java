package com.questrail.empire.protocol.gge.model;

import java.util.Objects;

/**
 * XML frame: {@code <msg t='tag'><body action='action' r='room'>body</body></msg>}.
 */
public record XmlResponse(String tag, String action, String room, String body) implements GgeResponse {

    public XmlResponse {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(room, "room");
        Objects.requireNonNull(body, "body");
    }
}
