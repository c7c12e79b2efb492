package com.orderbook;

import com.orderbook.config.EngineConfig;
import com.orderbook.engine.MatchingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Standalone entry point: builds an engine from environment variables,
 * starts it and keeps the sequencers running until the JVM is stopped.
 *
 * Startup sequence:
 * 1. Parse EngineConfig from environment variables
 * 2. Create the MatchingEngine (one sequencer per symbol)
 * 3. Start metrics exporter, sequencers and stats logger
 * 4. Register JVM shutdown hook
 */
public class OrderBookEngineApp {

    private static final Logger logger = LoggerFactory.getLogger(OrderBookEngineApp.class);

    public static void main(String[] args) throws InterruptedException {
        logger.info("Starting order book engine...");

        EngineConfig config;
        try {
            config = EngineConfig.fromEnv();
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        MatchingEngine engine = new MatchingEngine(config);
        try {
            engine.start();
        } catch (RuntimeException e) {
            logger.error("Failed to start engine {}: {}", config.getEngineId(), e.getMessage(), e);
            engine.close();
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(engine::close, "engine-shutdown"));

        // Sequencer threads are daemons; park main so the process stays up
        Thread.currentThread().join();
    }
}
