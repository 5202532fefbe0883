package in.gts.infrastructure.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.gts.application.port.output.LedgerEventRepository;
import in.gts.domain.common.EventType;
import in.gts.domain.event.LedgerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL implementation of LedgerEventRepository.
 * Table is created by {@link in.gts.migration.LedgerEventsMigration}.
 */
public final class PostgresLedgerEventRepository implements LedgerEventRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresLedgerEventRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String SELECT_COLUMNS = """
            SELECT seq, event_type, asset_id, offer_id, payload, created_at, created_by
            FROM ledger_events
            """;

    private final DataSource dataSource;

    public PostgresLedgerEventRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Inserts the whole batch in one transaction so a settlement's events are
     * stored together or not at all.
     */
    @Override
    public List<LedgerEvent> appendAll(List<LedgerEvent> events) {
        if (events.isEmpty()) {
            return List.of();
        }

        String sql = """
                INSERT INTO ledger_events (
                    event_type, asset_id, offer_id, payload, created_at, created_by
                ) VALUES (?, ?, ?, ?::jsonb, ?, ?)
                RETURNING seq
                """;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);

            List<LedgerEvent> persisted = new ArrayList<>(events.size());
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (LedgerEvent e : events) {
                    ps.setString(1, e.type().name());
                    setNullableLong(ps, 2, e.assetId());
                    setNullableLong(ps, 3, e.offerId());
                    ps.setString(4, MAPPER.writeValueAsString(e.payload()));
                    ps.setTimestamp(5, Timestamp.from(e.ts()));
                    ps.setString(6, e.createdBy());

                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            throw new SQLException("Insert returned no sequence for event " + e.type());
                        }
                        persisted.add(e.withSeq(rs.getLong("seq")));
                    }
                }
                conn.commit();
            } catch (Exception ex) {
                rollback(conn, ex);
                throw ex;
            }

            log.debug("Appended {} event(s), last seq={}", persisted.size(), persisted.get(persisted.size() - 1).seq());
            return persisted;
        } catch (Exception ex) {
            log.error("Failed to append {} event(s): {}", events.size(), ex.getMessage(), ex);
            throw new IllegalStateException("Failed to append events", ex);
        }
    }

    @Override
    public List<LedgerEvent> listAfterSeq(long afterSeq, int limit) {
        String sql = SELECT_COLUMNS + """
                WHERE seq > ?
                ORDER BY seq ASC
                LIMIT ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, afterSeq);
            ps.setInt(2, limit);

            return executeQuery(ps);
        } catch (Exception ex) {
            log.error("Failed to list events: {}", ex.getMessage(), ex);
            throw new IllegalStateException("Failed to list events", ex);
        }
    }

    @Override
    public List<LedgerEvent> listForAsset(long assetId) {
        return listByColumn("asset_id", assetId);
    }

    @Override
    public List<LedgerEvent> listForOffer(long offerId) {
        return listByColumn("offer_id", offerId);
    }

    @Override
    public long latestSeq() {
        String sql = "SELECT COALESCE(MAX(seq), 0) FROM ledger_events";

        try (Connection conn = dataSource.getConnection();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(sql)) {

            if (rs.next()) {
                return rs.getLong(1);
            }
            return 0L;
        } catch (Exception ex) {
            log.error("Failed to get latest seq: {}", ex.getMessage(), ex);
            throw new IllegalStateException("Failed to get latest seq", ex);
        }
    }

    private List<LedgerEvent> listByColumn(String column, long id) {
        String sql = SELECT_COLUMNS + "WHERE " + column + " = ?\nORDER BY seq ASC";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, id);

            return executeQuery(ps);
        } catch (Exception ex) {
            log.error("Failed to list events by {}: {}", column, ex.getMessage(), ex);
            throw new IllegalStateException("Failed to list events", ex);
        }
    }

    private List<LedgerEvent> executeQuery(PreparedStatement ps) throws Exception {
        List<LedgerEvent> events = new ArrayList<>();

        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                events.add(mapRow(rs));
            }
        }

        return events;
    }

    private LedgerEvent mapRow(ResultSet rs) throws Exception {
        long seq = rs.getLong("seq");
        EventType type = EventType.valueOf(rs.getString("event_type"));
        Long assetId = rs.getObject("asset_id", Long.class);
        Long offerId = rs.getObject("offer_id", Long.class);
        JsonNode payload = MAPPER.readTree(rs.getString("payload"));
        Instant ts = rs.getTimestamp("created_at").toInstant();
        String createdBy = rs.getString("created_by");

        return new LedgerEvent(seq, type, assetId, offerId, payload, ts, createdBy);
    }

    private static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.BIGINT);
        } else {
            ps.setLong(index, value);
        }
    }
}
