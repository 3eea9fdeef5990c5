package com.exchangesim.metrics;

import com.exchangesim.domain.OrderBook;
import io.prometheus.metrics.core.metrics.Counter;
import io.prometheus.metrics.core.metrics.Gauge;
import io.prometheus.metrics.core.metrics.Histogram;
import io.prometheus.metrics.model.registry.PrometheusRegistry;

import java.util.Collection;

/**
 * All Prometheus metrics for the exchange, defined in one place.
 * Each instance registers into its own {@link PrometheusRegistry}, so several
 * sessions (or tests) can live in one JVM.
 */
public class MetricsRegistry {

    public final Counter ordersReceivedTotal;
    // name: exchange_orders_received_total

    public final Counter tradesTotal;
    // name: exchange_trades_total

    public final Counter ordersRejectedTotal;
    // name: exchange_orders_rejected_total

    public final Histogram matchDuration;
    // name: exchange_match_duration_seconds

    public final Gauge orderbookDepth;
    // name: exchange_orderbook_depth

    private final PrometheusRegistry prometheusRegistry;

    public MetricsRegistry() {
        this(new PrometheusRegistry());
    }

    public MetricsRegistry(PrometheusRegistry prometheusRegistry) {
        this.prometheusRegistry = prometheusRegistry;

        ordersReceivedTotal = Counter.builder()
                .name("exchange_orders_received_total")
                .help("Total orders submitted to an order book")
                .labelNames("session", "side")
                .register(prometheusRegistry);

        tradesTotal = Counter.builder()
                .name("exchange_trades_total")
                .help("Total trades executed")
                .labelNames("session")
                .register(prometheusRegistry);

        ordersRejectedTotal = Counter.builder()
                .name("exchange_orders_rejected_total")
                .help("Orders rejected before matching")
                .labelNames("session", "reason")
                .register(prometheusRegistry);

        matchDuration = Histogram.builder()
                .name("exchange_match_duration_seconds")
                .help("Time spent in addOrder, from validation to resting the remainder")
                .labelNames("session")
                .classicOnly()
                .classicUpperBounds(0.00001, 0.0001, 0.0005, 0.001, 0.005, 0.01, 0.05)
                .register(prometheusRegistry);

        orderbookDepth = Gauge.builder()
                .name("exchange_orderbook_depth")
                .help("Resting orders across all registered books")
                .labelNames("session", "side")
                .register(prometheusRegistry);
    }

    /**
     * Refresh the depth gauges from the given books.
     */
    public void updateDepth(String sessionId, Collection<OrderBook> books) {
        int bidDepth = 0;
        int offerDepth = 0;
        for (OrderBook book : books) {
            bidDepth += book.getBidDepth();
            offerDepth += book.getOfferDepth();
        }
        orderbookDepth.labelValues(sessionId, "bid").set(bidDepth);
        orderbookDepth.labelValues(sessionId, "offer").set(offerDepth);
    }

    public PrometheusRegistry getPrometheusRegistry() {
        return prometheusRegistry;
    }
}
