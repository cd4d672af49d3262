package com.questrail.cabin.advisor.runtime;

import com.questrail.cabin.advisor.config.AdvisorRuntimeConfig;
import com.questrail.cabin.advisor.transport.BusConnectException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Process entry point. Configuration comes from the environment only; see
 * {@link AdvisorRuntimeConfig#fromEnvironment(java.util.Map)}.
 *
 * <p>Exit codes: {@code 1} when the bus cannot be reached, {@code 2} for
 * invalid configuration.</p>
 */
public final class CabinAdvisorMain
{
    private static final Logger log = LoggerFactory.getLogger(CabinAdvisorMain.class);

    private CabinAdvisorMain() {
    }

    public static void main(String[] args) throws InterruptedException {
        final AdvisorRuntimeConfig config;
        try {
            config = AdvisorRuntimeConfig.fromEnvironment(System.getenv());
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        log.info("Cabin advisor starting (broker {}:{}, client id {})",
                config.bus().host(), config.bus().port(), config.bus().clientId());

        AdvisorProductionRuntime runtime = AdvisorProductionRuntime.builder()
                .withConfig(config)
                .build();

        try {
            runtime.start();
        } catch (BusConnectException e) {
            log.error("Giving up: {}", e.getMessage(), e.getCause());
            System.exit(1);
            return;
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down cabin advisor");
            runtime.stop();
            shutdown.countDown();
        }, "cabin-advisor-shutdown"));

        log.info("Waiting for driver actions on {}", config.bus().actionsTopic());
        shutdown.await();
    }
}
