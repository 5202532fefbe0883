package in.gts.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Ledger Events Migration - Creates the durable event log table on startup.
 *
 * Creates:
 * - ledger_events: append-only notification log (seq is the BIGSERIAL order)
 * - indexes on asset_id / offer_id for correlation lookups
 */
public final class LedgerEventsMigration {
    private static final Logger log = LoggerFactory.getLogger(LedgerEventsMigration.class);

    static final String TABLE = "ledger_events";

    private final DataSource dataSource;

    public LedgerEventsMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Run migration - creates the table and indexes if they don't exist.
     *
     * @return true if the table was created, false if it already existed
     * @throws IllegalStateException if the database cannot be migrated
     */
    public boolean migrate() {
        log.info("[EVENTS MIGRATION] Starting ledger_events migration");

        try (Connection conn = dataSource.getConnection()) {
            if (tableExists(conn, TABLE)) {
                log.info("[EVENTS MIGRATION] {} table already exists", TABLE);
                return false;
            }

            log.info("[EVENTS MIGRATION] Creating {} table...", TABLE);
            createEventsTable(conn);
            log.info("[EVENTS MIGRATION] ✓ {} table created", TABLE);
            return true;
        } catch (SQLException e) {
            log.error("[EVENTS MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new IllegalStateException("ledger_events migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void createEventsTable(Connection conn) throws SQLException {
        String sql = """
            CREATE TABLE ledger_events (
                seq BIGSERIAL PRIMARY KEY,
                event_type VARCHAR(40) NOT NULL,
                asset_id BIGINT,
                offer_id BIGINT,
                payload JSONB NOT NULL,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                created_by VARCHAR(128)
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
            stmt.execute("CREATE INDEX idx_ledger_events_asset ON ledger_events (asset_id)");
            stmt.execute("CREATE INDEX idx_ledger_events_offer ON ledger_events (offer_id)");
        }
    }
}
