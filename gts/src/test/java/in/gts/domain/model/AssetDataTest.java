package in.gts.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Asset data")
class AssetDataTest {

    @Test
    @DisplayName("Hex with or without prefix decodes to the same bytes")
    void fromHex_prefixOptional() {
        assertEquals(AssetData.fromHex("0xabcd"), AssetData.fromHex("ABCD"));
        assertArrayEquals(new byte[]{(byte) 0xab, (byte) 0xcd}, AssetData.fromHex("0XaBcD").bytes());
        assertEquals("0xabcd", AssetData.fromHex("ABCD").toHex());
    }

    @Test
    @DisplayName("Odd length and non-hex text are rejected")
    void fromHex_rejectsMalformed() {
        assertThrows(IllegalArgumentException.class, () -> AssetData.fromHex("abc"));
        assertThrows(IllegalArgumentException.class, () -> AssetData.fromHex("zz"));
    }

    @Test
    @DisplayName("Empty input is EMPTY")
    void empty() {
        assertSame(AssetData.EMPTY, AssetData.of(new byte[0]));
        assertEquals(AssetData.EMPTY, AssetData.fromHex("0x"));
        assertEquals("0x", AssetData.EMPTY.toHex());
        assertEquals(0, AssetData.EMPTY.length());
    }

    @Test
    @DisplayName("Stored bytes cannot be changed through input or output arrays")
    void immutable() {
        byte[] input = {1, 2, 3};
        AssetData data = AssetData.of(input);
        input[0] = 9;
        data.bytes()[1] = 9;

        assertArrayEquals(new byte[]{1, 2, 3}, data.bytes());
    }
}
