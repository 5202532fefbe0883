package in.gts.security;

import in.gts.domain.model.Principal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for request input validation.
 */
@DisplayName("Input Validator Tests")
public class InputValidatorTest {

    private InputValidator validator;

    @BeforeEach
    public void setUp() {
        validator = new InputValidator(4, 3);
    }

    @Test
    @DisplayName("Principal identifiers")
    public void testPrincipals() {
        assertTrue(validator.isValidPrincipal("alice"));
        assertFalse(validator.isValidPrincipal("*"));
        assertFalse(validator.isValidPrincipal("alice; DROP TABLE"));
        assertEquals(Principal.of("bob"), validator.principal("bob", "owner"));
        assertThrows(IllegalArgumentException.class, () -> validator.principal(null, "owner"));
    }

    @Test
    @DisplayName("Absent, blank or * recipient means public")
    public void testRecipient() {
        assertSame(Principal.PUBLIC, validator.recipient(null));
        assertSame(Principal.PUBLIC, validator.recipient(" "));
        assertSame(Principal.PUBLIC, validator.recipient("*"));
        assertEquals(Principal.of("bob"), validator.recipient("bob"));
        assertThrows(IllegalArgumentException.class, () -> validator.recipient("b o b"));
    }

    @Test
    @DisplayName("Data size and hex format")
    public void testData() {
        assertEquals(0, validator.data(null).length());
        assertEquals(4, validator.data("0x01020304").length());
        assertThrows(IllegalArgumentException.class, () -> validator.data("0x0102030405"));
        assertThrows(IllegalArgumentException.class, () -> validator.data("0xzz"));
        assertThrows(IllegalArgumentException.class, () -> validator.data("abc"));
    }

    @Test
    @DisplayName("Asset id lists")
    public void testAssetIds() {
        assertEquals(List.of(1L, 1L, 2L), validator.assetIds(List.of(1L, 1L, 2L), "myAssets"));
        assertEquals(List.of(), validator.assetIds(List.of(), "myAssets"));
        assertThrows(IllegalArgumentException.class, () -> validator.assetIds(null, "myAssets"));
        assertThrows(IllegalArgumentException.class, () -> validator.assetIds(List.of(1L, 2L, 3L, 4L), "myAssets"));
        assertThrows(IllegalArgumentException.class, () -> validator.assetIds(List.of(0L), "theirAssets"));
        assertThrows(IllegalArgumentException.class, () -> validator.assetIds(List.of(-5L), "theirAssets"));
        assertThrows(IllegalArgumentException.class,
            () -> validator.assetIds(Collections.singletonList(null), "theirAssets"));
        assertThrows(IllegalArgumentException.class,
            () -> validator.assetIds(Arrays.asList(1L, null), "theirAssets"));
    }

    @Test
    @DisplayName("Numeric parameters")
    public void testNumbers() {
        assertEquals(12L, validator.id("12", "assetId"));
        assertThrows(IllegalArgumentException.class, () -> validator.id("0", "assetId"));
        assertThrows(IllegalArgumentException.class, () -> validator.id("twelve", "assetId"));
        assertThrows(IllegalArgumentException.class, () -> validator.id(null, "assetId"));
        assertEquals(7L, validator.nonNegative(null, "limit", 7));
        assertEquals(0L, validator.nonNegative("0", "afterSeq", 3));
        assertThrows(IllegalArgumentException.class, () -> validator.nonNegative("-1", "limit", 7));
    }
}
