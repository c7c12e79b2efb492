package com.orderbook.metrics;

import com.orderbook.domain.BookSnapshot;
import io.prometheus.metrics.core.metrics.Counter;
import io.prometheus.metrics.core.metrics.Gauge;
import io.prometheus.metrics.core.metrics.Histogram;
import io.prometheus.metrics.exporter.httpserver.HTTPServer;
import io.prometheus.metrics.instrumentation.jvm.JvmMetrics;
import io.prometheus.metrics.model.registry.PrometheusRegistry;

import java.io.IOException;

/**
 * All Prometheus metrics for one engine instance, defined in one place.
 *
 * Metrics go into a registry owned by this instance rather than the JVM-wide
 * default, so several engines can live in one process.
 */
public class MetricsRegistry {

    // ---- Latency ----
    public final Histogram matchDuration;
    // name: ob_match_duration_seconds

    // ---- Throughput ----
    public final Counter ordersReceivedTotal;
    // name: ob_orders_received_total

    public final Counter tradesTotal;
    // name: ob_trades_total

    public final Counter tradedQuantityTotal;
    // name: ob_traded_quantity_total

    public final Counter rejectionsTotal;
    // name: ob_rejections_total

    public final Counter cancelsTotal;
    // name: ob_cancels_total

    // ---- Order Book health ----
    public final Gauge orderbookDepth;
    // name: ob_orderbook_depth

    public final Gauge orderbookPriceLevels;
    // name: ob_orderbook_price_levels

    private final PrometheusRegistry registry;
    private HTTPServer httpServer;

    public MetricsRegistry() {
        registry = new PrometheusRegistry();

        matchDuration = Histogram.builder()
                .name("ob_match_duration_seconds")
                .help("Time spent applying one command to the order book")
                .labelNames("symbol", "command")
                .classicOnly()
                .classicUpperBounds(0.00001, 0.00005, 0.0001, 0.0005, 0.001, 0.005, 0.01, 0.05)
                .register(registry);

        ordersReceivedTotal = Counter.builder()
                .name("ob_orders_received_total")
                .help("Total orders received by the sequencer")
                .labelNames("symbol", "side")
                .register(registry);

        tradesTotal = Counter.builder()
                .name("ob_trades_total")
                .help("Total trades executed")
                .labelNames("symbol")
                .register(registry);

        tradedQuantityTotal = Counter.builder()
                .name("ob_traded_quantity_total")
                .help("Total quantity executed across all trades")
                .labelNames("symbol")
                .register(registry);

        rejectionsTotal = Counter.builder()
                .name("ob_rejections_total")
                .help("Commands rejected by the order book")
                .labelNames("symbol", "reason")
                .register(registry);

        cancelsTotal = Counter.builder()
                .name("ob_cancels_total")
                .help("Resting orders cancelled")
                .labelNames("symbol")
                .register(registry);

        orderbookDepth = Gauge.builder()
                .name("ob_orderbook_depth")
                .help("Current resting orders")
                .labelNames("symbol", "side")
                .register(registry);

        orderbookPriceLevels = Gauge.builder()
                .name("ob_orderbook_price_levels")
                .help("Distinct price levels")
                .labelNames("symbol", "side")
                .register(registry);

        // Register JVM metrics (GC, memory, threads)
        JvmMetrics.builder().register(registry);
    }

    /**
     * Refresh the depth gauges from the snapshot just published for a book.
     */
    public void recordBook(BookSnapshot snapshot) {
        String symbol = snapshot.getSymbol();
        orderbookDepth.labelValues(symbol, "bid").set(snapshot.getBidOrders());
        orderbookDepth.labelValues(symbol, "ask").set(snapshot.getAskOrders());
        orderbookPriceLevels.labelValues(symbol, "bid").set(snapshot.getBidLevels());
        orderbookPriceLevels.labelValues(symbol, "ask").set(snapshot.getAskLevels());
    }

    /**
     * Start the Prometheus HTTP server on the given port.
     * Exposes /metrics endpoint for Prometheus scraping.
     */
    public void startHttpServer(int port) throws IOException {
        httpServer = HTTPServer.builder()
                .port(port)
                .registry(registry)
                .buildAndStart();
    }

    public PrometheusRegistry getRegistry() {
        return registry;
    }

    /**
     * Stop the Prometheus HTTP server.
     */
    public void close() {
        if (httpServer != null) {
            httpServer.close();
        }
    }
}
