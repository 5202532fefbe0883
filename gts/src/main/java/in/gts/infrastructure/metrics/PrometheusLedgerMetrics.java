package in.gts.infrastructure.metrics;

import in.gts.domain.common.LedgerErrorCode;
import in.gts.domain.model.OfferState;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of LedgerMetrics interface.
 *
 * Key Metrics:
 * - ledger_assets_issued_total - Assets issued
 * - ledger_assets_retracted_total - Assets retracted by their emitter
 * - ledger_offer_transitions_total{state} - Offers entering each state
 * - ledger_rejections_total{operation, code} - Rejected operations
 * - ledger_settlement_latency_seconds - Validate + swap duration
 * - ledger_settlement_assets_moved - Ownership moves per settlement
 * - ledger_live_assets / ledger_pending_offers - Table sizes
 *
 * Gauges move with each recorded change; nothing rescans the tables.
 * Metrics are exposed at /metrics by the HTTP API.
 */
public class PrometheusLedgerMetrics implements LedgerMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusLedgerMetrics.class);

    private final CollectorRegistry registry;

    private final Counter issuedCounter;
    private final Counter retractedCounter;
    private final Counter offerTransitionCounter;
    private final Counter rejectionCounter;
    private final Histogram settlementLatency;
    private final Histogram settlementSize;
    private final Gauge liveAssets;
    private final Gauge pendingOffers;

    public PrometheusLedgerMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusLedgerMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.issuedCounter = Counter.build()
            .name("ledger_assets_issued_total")
            .help("Total number of assets issued")
            .register(registry);

        this.retractedCounter = Counter.build()
            .name("ledger_assets_retracted_total")
            .help("Total number of assets retracted")
            .register(registry);

        this.offerTransitionCounter = Counter.build()
            .name("ledger_offer_transitions_total")
            .help("Total number of offers entering each state")
            .labelNames("state")
            .register(registry);

        this.rejectionCounter = Counter.build()
            .name("ledger_rejections_total")
            .help("Total number of rejected ledger operations")
            .labelNames("operation", "code")
            .register(registry);

        this.settlementLatency = Histogram.build()
            .name("ledger_settlement_latency_seconds")
            .help("Settlement validation and swap latency in seconds")
            .buckets(0.0001, 0.0005, 0.001, 0.005, 0.01, 0.05, 0.1)
            .register(registry);

        this.settlementSize = Histogram.build()
            .name("ledger_settlement_assets_moved")
            .help("Number of ownership moves applied per settlement")
            .buckets(0, 1, 2, 5, 10, 25, 50, 100)
            .register(registry);

        this.liveAssets = Gauge.build()
            .name("ledger_live_assets")
            .help("Number of assets currently in the registry")
            .register(registry);

        this.pendingOffers = Gauge.build()
            .name("ledger_pending_offers")
            .help("Number of offers currently PENDING")
            .register(registry);

        log.info("PrometheusLedgerMetrics initialized");
    }

    @Override
    public void recordIssued() {
        issuedCounter.inc();
        liveAssets.inc();
    }

    @Override
    public void recordRetracted() {
        retractedCounter.inc();
        liveAssets.dec();
    }

    @Override
    public void recordOfferTransition(OfferState state) {
        offerTransitionCounter.labels(state.name()).inc();
        if (state.isTerminal()) {
            pendingOffers.dec();
        } else {
            pendingOffers.inc();
        }
    }

    @Override
    public void recordRejection(String operation, LedgerErrorCode code) {
        rejectionCounter.labels(operation, code.name()).inc();
    }

    @Override
    public void recordSettlement(int assetsMoved, Duration latency) {
        settlementSize.observe(assetsMoved);
        settlementLatency.observe(latency.toNanos() / 1_000_000_000.0);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
