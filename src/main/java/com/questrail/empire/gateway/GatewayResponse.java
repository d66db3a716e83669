package com.questrail.empire.gateway;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * HTTP-style answer of the gateway: a status code and a JSON body.
 */
public record GatewayResponse(int status, ObjectNode body) {

    public static final int OK = 200;
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int SERVER_ERROR = 500;

    public GatewayResponse {
        Objects.requireNonNull(body, "body");
    }
}
