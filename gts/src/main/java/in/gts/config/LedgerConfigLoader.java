package in.gts.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.gts.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Loads {@link LedgerConfig}.
 *
 * Order: defaults, then the JSON file named by GTS_CONFIG (if any), then
 * individual environment variables / system properties:
 * PORT, EVENT_STORE, DB_URL, DB_USER, DB_PASS, DB_POOL_SIZE,
 * MAX_DATA_BYTES, MAX_ASSETS_PER_SIDE, EVENT_PAGE_LIMIT.
 */
public final class LedgerConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(LedgerConfigLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String CONFIG_PATH_KEY = "GTS_CONFIG";

    private LedgerConfigLoader() {}

    /**
     * @throws IllegalStateException if the file cannot be read or the result is invalid
     */
    public static LedgerConfig load() {
        String path = Env.get(CONFIG_PATH_KEY, null);
        LedgerConfig base = path != null ? fromFile(Paths.get(path)) : LedgerConfig.defaults();

        LedgerConfig config;
        try {
            config = applyOverrides(base);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid ledger configuration override: " + e.getMessage(), e);
        }

        if (!config.isValid()) {
            throw new IllegalStateException("Invalid ledger configuration: " + config);
        }

        log.info("Ledger config: {}", config);
        return config;
    }

    /**
     * Read a JSON config file. Fields the file omits keep their defaults.
     */
    static LedgerConfig fromFile(Path file) {
        if (!Files.exists(file)) {
            throw new IllegalStateException("Config file not found: " + file);
        }
        try {
            JsonNode fromFile = MAPPER.readTree(Files.readString(file));
            if (fromFile == null || !fromFile.isObject()) {
                throw new IllegalStateException("Config file is not a JSON object: " + file);
            }

            ObjectNode merged = MAPPER.valueToTree(LedgerConfig.defaults());
            merged.setAll((ObjectNode) fromFile);

            LedgerConfig config = MAPPER.treeToValue(merged, LedgerConfig.class);
            log.info("Loaded ledger config from: {}", file);
            return config;
        } catch (IOException e) {
            log.error("Failed to read ledger config {}: {}", file, e.getMessage());
            throw new IllegalStateException("Failed to read config file: " + file, e);
        }
    }

    static LedgerConfig applyOverrides(LedgerConfig c) {
        return new LedgerConfig(
            Env.getInt("PORT", c.port()),
            eventStore(Env.get("EVENT_STORE", null), c.eventStore()),
            Env.get("DB_URL", c.dbUrl()),
            Env.get("DB_USER", c.dbUser()),
            Env.get("DB_PASS", c.dbPassword()),
            Env.getInt("DB_POOL_SIZE", c.dbPoolSize()),
            Env.getInt("MAX_DATA_BYTES", c.maxDataBytes()),
            Env.getInt("MAX_ASSETS_PER_SIDE", c.maxAssetsPerSide()),
            Env.getInt("EVENT_PAGE_LIMIT", c.eventPageLimit())
        );
    }

    private static LedgerConfig.EventStore eventStore(String value, LedgerConfig.EventStore fallback) {
        if (value == null) return fallback;
        try {
            return LedgerConfig.EventStore.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown EVENT_STORE: " + value, e);
        }
    }
}
