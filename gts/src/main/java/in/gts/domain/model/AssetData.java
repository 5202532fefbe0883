package in.gts.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Opaque issuance metadata attached to an asset.
 *
 * Interpretation (integer id, JSON blob, content hash) is the emitter's convention;
 * the ledger only stores and returns the bytes. Immutable: input and output arrays are copied.
 */
public final class AssetData {

    private static final HexFormat HEX = HexFormat.of();

    public static final AssetData EMPTY = new AssetData(new byte[0]);

    private final byte[] bytes;

    private AssetData(byte[] bytes) {
        this.bytes = bytes;
    }

    public static AssetData of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return bytes.length == 0 ? EMPTY : new AssetData(bytes.clone());
    }

    /**
     * Parse hex text, with or without a leading "0x".
     *
     * @throws IllegalArgumentException on odd length or non-hex characters
     */
    public static AssetData fromHex(String hex) {
        Objects.requireNonNull(hex, "hex");
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.length() % 2 != 0) {
            throw new IllegalArgumentException("Hex data must have an even number of digits: " + hex);
        }
        return of(HEX.parseHex(digits));
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    @JsonValue
    public String toHex() {
        return "0x" + HEX.formatHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AssetData)) return false;
        return Arrays.equals(bytes, ((AssetData) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
