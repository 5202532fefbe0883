package in.gts.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.gts.application.port.output.AssetRepository;
import in.gts.application.port.output.LedgerEventRepository;
import in.gts.application.port.output.TradeOfferRepository;
import in.gts.application.service.AssetRegistryServiceImpl;
import in.gts.application.service.EventService;
import in.gts.application.service.LedgerCoordinator;
import in.gts.application.service.PrincipalIndex;
import in.gts.application.service.TradeOfferServiceImpl;
import in.gts.config.LedgerConfig;
import in.gts.config.LedgerConfigLoader;
import in.gts.infrastructure.metrics.PrometheusLedgerMetrics;
import in.gts.infrastructure.persistence.InMemoryAssetRepository;
import in.gts.infrastructure.persistence.InMemoryLedgerEventRepository;
import in.gts.infrastructure.persistence.InMemoryTradeOfferRepository;
import in.gts.infrastructure.persistence.PostgresLedgerEventRepository;
import in.gts.migration.LedgerEventsMigration;
import in.gts.security.InputValidator;
import in.gts.transport.http.LedgerApiHandlers;
import io.undertow.Undertow;
import io.undertow.server.handlers.BlockingHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Core Java entry point (no framework).
 *
 * Wires:
 * - LedgerConfig (file + environment)
 * - Asset / offer tables (in memory) and the event log (memory or PostgreSQL)
 * - LedgerCoordinator, PrincipalIndex, EventService
 * - AssetRegistryService and TradeOfferService
 * - Prometheus metrics and the Undertow HTTP API
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Shared Ownership Ledger Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        LedgerConfig config = LedgerConfigLoader.load();

        // ═══════════════════════════════════════════════════════════════
        // Event log
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = null;
        LedgerEventRepository eventRepo;
        if (config.eventStore() == LedgerConfig.EventStore.POSTGRES) {
            dataSource = createDataSource(config);
            new LedgerEventsMigration(dataSource).migrate();
            eventRepo = new PostgresLedgerEventRepository(dataSource);
            log.info("✓ Event log: PostgreSQL");
        } else {
            eventRepo = new InMemoryLedgerEventRepository();
            log.info("✓ Event log: in memory");
        }

        // ═══════════════════════════════════════════════════════════════
        // Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusLedgerMetrics metrics = new PrometheusLedgerMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Ledger core
        // ═══════════════════════════════════════════════════════════════
        AssetRepository assetRepo = new InMemoryAssetRepository();
        TradeOfferRepository offerRepo = new InMemoryTradeOfferRepository();
        LedgerCoordinator coordinator = new LedgerCoordinator();
        PrincipalIndex index = new PrincipalIndex();
        EventService eventService = new EventService(eventRepo, coordinator);

        AssetRegistryServiceImpl assetRegistry =
            new AssetRegistryServiceImpl(assetRepo, index, eventService, coordinator, metrics);
        TradeOfferServiceImpl tradeOffers =
            new TradeOfferServiceImpl(offerRepo, assetRegistry, index, eventService, coordinator, metrics);

        // ═══════════════════════════════════════════════════════════════
        // HTTP API
        // ═══════════════════════════════════════════════════════════════
        InputValidator validator = new InputValidator(config.maxDataBytes(), config.maxAssetsPerSide());
        LedgerApiHandlers api = new LedgerApiHandlers(
            assetRegistry, tradeOffers, eventService, index, coordinator, validator,
            metrics.getRegistry(), config.eventPageLimit());

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(new BlockingHandler(api.routes()))
            .build();

        server.start();
        log.info("✓ HTTP API server started on port {}", config.port());

        HikariDataSource pool = dataSource;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down ledger");
            server.stop();
            coordinator.shutdown();
            if (pool != null) {
                pool.close();
            }
            log.info("Ledger stopped");
        }, "ledger-shutdown"));
    }

    private static HikariDataSource createDataSource(LedgerConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPassword());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(Math.min(2, config.dbPoolSize()));
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("gts-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }

    private App() {}
}
