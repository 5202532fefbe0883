package in.gts.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Ledger server configuration.
 *
 * Loaded by {@link LedgerConfigLoader}: JSON file first, then environment overrides.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LedgerConfig(
    @JsonProperty("port")
    int port,                   // HTTP listen port

    @JsonProperty("eventStore")
    EventStore eventStore,      // MEMORY | POSTGRES

    @JsonProperty("dbUrl")
    String dbUrl,

    @JsonProperty("dbUser")
    String dbUser,

    @JsonProperty("dbPassword")
    String dbPassword,

    @JsonProperty("dbPoolSize")
    int dbPoolSize,

    @JsonProperty("maxDataBytes")
    int maxDataBytes,           // Largest issuance payload accepted over HTTP

    @JsonProperty("maxAssetsPerSide")
    int maxAssetsPerSide,       // Largest myAssets / theirAssets list accepted over HTTP

    @JsonProperty("eventPageLimit")
    int eventPageLimit          // Upper bound for one /api/events page
) {
    public enum EventStore { MEMORY, POSTGRES }

    public static LedgerConfig defaults() {
        return new LedgerConfig(
            9090,
            EventStore.MEMORY,
            "jdbc:postgresql://localhost:5432/gts",
            "postgres",
            "postgres",
            10,
            4096,
            256,
            500
        );
    }

    /**
     * Validate configuration values.
     */
    @JsonIgnore
    public boolean isValid() {
        return port > 0 && port <= 65535
            && eventStore != null
            && maxDataBytes >= 0
            && maxAssetsPerSide > 0
            && eventPageLimit > 0
            && (eventStore != EventStore.POSTGRES
                || (dbUrl != null && !dbUrl.isBlank() && dbPoolSize > 0));
    }

    @Override
    public String toString() {
        return "LedgerConfig[port=" + port + ", eventStore=" + eventStore + ", dbUrl=" + dbUrl
            + ", dbUser=" + dbUser + ", dbPoolSize=" + dbPoolSize + ", maxDataBytes=" + maxDataBytes
            + ", maxAssetsPerSide=" + maxAssetsPerSide + ", eventPageLimit=" + eventPageLimit + "]";
    }
}
