package com.questrail.empire.protocol.gge.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of GgeObservabilitySink that emits logs via SLF4J.
 *
 * <p>Every line is prefixed with {@code [TYPE][ZONE]} so that output from dozens of
 * concurrent connections can be told apart.</p>
 */
public final class Slf4jGgeObservabilitySink implements GgeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jGgeObservabilitySink.class);

    @Override
    public void onConnectionEvent(GgeConnectionEvent event) {
        switch (event.kind()) {
            case LOGIN_REJECTED:
                log.error("[{}][{}] Login rejected: {}", event.serverType(), event.zone(), event.detail());
                break;
            case CHECK_TIMEOUT:
            case DISCONNECTED:
                log.warn("[{}][{}] {}: {}", event.serverType(), event.zone(), event.kind(), event.detail());
                break;
            case CHECK_OK:
                log.debug("[{}][{}] Connection check ok", event.serverType(), event.zone());
                break;
            default:
                log.info("[{}][{}] {}: {}", event.serverType(), event.zone(), event.kind(), event.detail());
        }
    }

    @Override
    public void onTransportEvent(GgeTransportEvent event) {
        if (event.kind() == GgeTransportEvent.Kind.CLOSED) {
            log.info("[{}][{}] Transport closed ({}) {}",
                event.serverType(), event.zone(), event.closeCode(), event.detail());
        } else {
            log.debug("[{}][{}] Transport {}: {}", event.serverType(), event.zone(), event.kind(), event.detail());
        }
    }

    @Override
    public void onRestartScheduled(GgeRestartEvent event) {
        if (event.kind() == GgeRestartEvent.Kind.LOGIN_RETRY) {
            log.warn("[{}][{}] Login failed ({}), retrying in {}s",
                event.serverType(), event.zone(), event.reason(), event.delay().toSeconds());
        } else {
            log.warn("[{}][{}] Restart #{} in {}s ({})",
                event.serverType(), event.zone(), event.attempt() + 1, event.delay().toSeconds(), event.reason());
        }
    }

    @Override
    public void onError(GgeErrorEvent event) {
        log.error("[{}][{}] {}", event.serverType(), event.zone(), event.message(), event.cause());
    }
}
