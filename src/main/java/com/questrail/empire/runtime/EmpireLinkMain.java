package com.questrail.empire.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.empire.config.ConfigLoader;
import com.questrail.empire.config.EmpireLinkConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process entry point: load configuration, start every connection and stop them
 * again on JVM shutdown.
 */
public final class EmpireLinkMain {
    private static final Logger log = LoggerFactory.getLogger(EmpireLinkMain.class);

    private EmpireLinkMain() {
    }

    public static void main(String[] args) {
        ObjectMapper mapper = new ObjectMapper();
        EmpireLinkConfig config = new ConfigLoader(mapper).load();
        log.info("Allowed zones: {}", config.allowedZones());

        EmpireLinkRuntime runtime = EmpireLinkRuntime.builder()
                .withConfig(config)
                .withObjectMapper(mapper)
                .build();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            runtime.stop();
        }, "empire-link-shutdown"));

        runtime.start();
    }
}
