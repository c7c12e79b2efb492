package com.orderbook.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration parsed from environment variables.
 * Each engine instance runs one sequencer per configured symbol.
 */
public class EngineConfig {

    private final String engineId;
    private final List<String> symbols;
    private final int ringBufferSize;
    private final WaitStrategyType waitStrategy;
    private final int metricsPort;
    private final int statsIntervalSeconds;
    private final boolean detailedLogging;

    /**
     * Ring-buffer consumer wait strategies. BLOCKING parks the sequencer
     * thread when idle; YIELDING and BUSY_SPIN trade a CPU core for latency.
     */
    public enum WaitStrategyType {
        BLOCKING,
        YIELDING,
        BUSY_SPIN;

        static WaitStrategyType parse(String value) {
            String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
            try {
                return WaitStrategyType.valueOf(normalized);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown WAIT_STRATEGY: " + value, e);
            }
        }
    }

    private EngineConfig(String engineId, List<String> symbols, int ringBufferSize,
                         WaitStrategyType waitStrategy, int metricsPort,
                         int statsIntervalSeconds, boolean detailedLogging) {
        this.engineId = engineId;
        this.symbols = symbols;
        this.ringBufferSize = ringBufferSize;
        this.waitStrategy = waitStrategy;
        this.metricsPort = metricsPort;
        this.statsIntervalSeconds = statsIntervalSeconds;
        this.detailedLogging = detailedLogging;
    }

    /**
     * Parse configuration from environment variables with sensible defaults.
     */
    public static EngineConfig fromEnv() {
        return fromMap(System.getenv());
    }

    /**
     * Parse configuration from an arbitrary key/value source using the same
     * keys and defaults as {@link #fromEnv()}.
     *
     * @throws IllegalArgumentException if the symbol list is empty, the ring
     *         buffer size is not a power of two, or the wait strategy is unknown
     */
    public static EngineConfig fromMap(Map<String, String> source) {
        String engineId = get(source, "ENGINE_ID", "engine-1");
        List<String> symbols = parseSymbols(get(source, "SYMBOLS", "BTC-USD"));
        int ringBufferSize = getInt(source, "RING_BUFFER_SIZE", 1024);
        WaitStrategyType waitStrategy =
                WaitStrategyType.parse(get(source, "WAIT_STRATEGY", "blocking"));
        int metricsPort = getInt(source, "METRICS_PORT", 0);
        int statsIntervalSeconds = getInt(source, "STATS_INTERVAL_SECONDS", 10);
        boolean detailedLogging = Boolean.parseBoolean(get(source, "DETAILED_LOGGING", "false"));

        if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1) {
            throw new IllegalArgumentException(
                    "RING_BUFFER_SIZE must be a power of two: " + ringBufferSize);
        }

        return new EngineConfig(engineId, symbols, ringBufferSize, waitStrategy,
                metricsPort, statsIntervalSeconds, detailedLogging);
    }

    private static List<String> parseSymbols(String csv) {
        List<String> symbols = new ArrayList<>();
        for (String symbol : csv.split(",")) {
            String trimmed = symbol.trim();
            if (!trimmed.isEmpty() && !symbols.contains(trimmed)) {
                symbols.add(trimmed);
            }
        }
        if (symbols.isEmpty()) {
            throw new IllegalArgumentException("SYMBOLS must name at least one symbol");
        }
        return Collections.unmodifiableList(symbols);
    }

    private static String get(Map<String, String> source, String key, String defaultValue) {
        String value = source.get(key);
        return (value != null && !value.isEmpty()) ? value : defaultValue;
    }

    private static int getInt(Map<String, String> source, String key, int defaultValue) {
        String value = source.get(key);
        if (value != null && !value.isEmpty()) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public String getEngineId() {
        return engineId;
    }

    public List<String> getSymbols() {
        return symbols;
    }

    public int getRingBufferSize() {
        return ringBufferSize;
    }

    public WaitStrategyType getWaitStrategy() {
        return waitStrategy;
    }

    public int getMetricsPort() {
        return metricsPort;
    }

    public int getStatsIntervalSeconds() {
        return statsIntervalSeconds;
    }

    public boolean isDetailedLogging() {
        return detailedLogging;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "engineId='" + engineId + '\'' +
                ", symbols=" + symbols +
                ", ringBufferSize=" + ringBufferSize +
                ", waitStrategy=" + waitStrategy +
                ", metricsPort=" + metricsPort +
                ", statsIntervalSeconds=" + statsIntervalSeconds +
                ", detailedLogging=" + detailedLogging +
                '}';
    }
}
