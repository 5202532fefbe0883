package in.gts.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Ledger config loading")
class LedgerConfigLoaderTest {

    @TempDir
    Path dir;

    @AfterEach
    void clearOverrides() {
        System.clearProperty(LedgerConfigLoader.CONFIG_PATH_KEY);
        System.clearProperty("PORT");
        System.clearProperty("EVENT_STORE");
        System.clearProperty("MAX_ASSETS_PER_SIDE");
    }

    @Test
    @DisplayName("Defaults are valid")
    void defaults_valid() {
        LedgerConfig config = LedgerConfig.defaults();

        assertTrue(config.isValid());
        assertEquals(LedgerConfig.EventStore.MEMORY, config.eventStore());
    }

    @Test
    @DisplayName("Partial file overrides only the fields it names")
    void fromFile_partialMerge() throws Exception {
        Path file = dir.resolve("ledger.json");
        Files.writeString(file, "{\"port\": 8181, \"maxAssetsPerSide\": 16, \"unknown\": true}");

        LedgerConfig config = LedgerConfigLoader.fromFile(file);

        assertEquals(8181, config.port());
        assertEquals(16, config.maxAssetsPerSide());
        assertEquals(LedgerConfig.defaults().maxDataBytes(), config.maxDataBytes());
        assertEquals(LedgerConfig.EventStore.MEMORY, config.eventStore());
    }

    @Test
    @DisplayName("Environment overrides win over the file")
    void load_overridesWin() throws Exception {
        Path file = dir.resolve("ledger.json");
        Files.writeString(file, "{\"port\": 8181, \"eventStore\": \"MEMORY\"}");
        System.setProperty(LedgerConfigLoader.CONFIG_PATH_KEY, file.toString());
        System.setProperty("PORT", "8282");

        LedgerConfig config = LedgerConfigLoader.load();

        assertEquals(8282, config.port());
    }

    @Test
    @DisplayName("Missing file, bad JSON and invalid values refuse startup")
    void load_invalidRefused() throws Exception {
        assertThrows(IllegalStateException.class, () -> LedgerConfigLoader.fromFile(dir.resolve("absent.json")));

        Path broken = dir.resolve("broken.json");
        Files.writeString(broken, "{ port: ");
        assertThrows(IllegalStateException.class, () -> LedgerConfigLoader.fromFile(broken));

        System.setProperty("MAX_ASSETS_PER_SIDE", "0");
        assertThrows(IllegalStateException.class, LedgerConfigLoader::load);

        System.setProperty("MAX_ASSETS_PER_SIDE", "many");
        assertThrows(IllegalStateException.class, LedgerConfigLoader::load);

        System.clearProperty("MAX_ASSETS_PER_SIDE");
        System.setProperty("EVENT_STORE", "CASSANDRA");
        assertThrows(IllegalStateException.class, LedgerConfigLoader::load);
    }

    @Test
    @DisplayName("Password never appears in the rendered config")
    void toString_hidesPassword() {
        assertFalse(LedgerConfig.defaults().toString().contains("dbPassword"));
    }
}
