package in.gts.security;

import in.gts.domain.model.AssetData;
import in.gts.domain.model.Principal;

import java.util.List;

/**
 * Input validator for requests arriving over HTTP.
 *
 * The ledger core trusts its callers; everything a remote client controls is
 * checked here first:
 * - Principal identifiers (header and path segments)
 * - Issuance data (hex text, size cap)
 * - Asset id lists on offers (positive ids, size cap per side)
 * - Numeric path and query parameters
 *
 * All violations throw IllegalArgumentException, which the HTTP layer maps to 400.
 */
public class InputValidator {

    private final int maxDataBytes;
    private final int maxAssetsPerSide;

    public InputValidator(int maxDataBytes, int maxAssetsPerSide) {
        this.maxDataBytes = maxDataBytes;
        this.maxAssetsPerSide = maxAssetsPerSide;
    }

    /**
     * Check a principal identifier without throwing.
     *
     * @return true if the identifier names a real principal
     */
    public boolean isValidPrincipal(String id) {
        return Principal.isValidId(id);
    }

    /**
     * @throws IllegalArgumentException if the identifier is malformed
     */
    public Principal principal(String id, String fieldName) {
        if (!isValidPrincipal(id)) {
            throw new IllegalArgumentException("Invalid " + fieldName + ": " + id);
        }
        return Principal.of(id);
    }

    /**
     * Parse an offer recipient. Absent, blank or "*" mean a public offer.
     */
    public Principal recipient(String id) {
        if (id == null || id.isBlank() || "*".equals(id)) {
            return Principal.PUBLIC;
        }
        return principal(id, "recipient");
    }

    /**
     * Parse issuance data.
     *
     * Rules:
     * - Hex text, optional 0x prefix; null or empty means no data
     * - Decoded length <= maxDataBytes
     *
     * @throws IllegalArgumentException if invalid
     */
    public AssetData data(String hex) {
        if (hex == null || hex.isEmpty()) {
            return AssetData.EMPTY;
        }

        // Cheap length check before decoding
        int digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.length() - 2 : hex.length();
        if (digits / 2 > maxDataBytes) {
            throw new IllegalArgumentException("Data exceeds maximum (" + maxDataBytes + " bytes)");
        }

        try {
            return AssetData.fromHex(hex);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Data is not valid hex: " + e.getMessage(), e);
        }
    }

    /**
     * Validate one side of an offer.
     *
     * Rules:
     * - Not null
     * - At most maxAssetsPerSide entries
     * - Every id positive
     *
     * @param side Field name for error messages
     * @throws IllegalArgumentException if invalid
     */
    public List<Long> assetIds(List<Long> ids, String side) {
        if (ids == null) {
            throw new IllegalArgumentException(side + " is required");
        }

        if (ids.size() > maxAssetsPerSide) {
            throw new IllegalArgumentException(side + " exceeds maximum (" + maxAssetsPerSide + " ids): " + ids.size());
        }

        for (Long id : ids) {
            if (id == null || id <= 0) {
                throw new IllegalArgumentException(side + " contains an invalid asset id: " + id);
            }
        }

        return List.copyOf(ids);
    }

    /**
     * Parse a positive numeric id from a path segment.
     *
     * @throws IllegalArgumentException if missing, non-numeric or not positive
     */
    public long id(String raw, String fieldName) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException(fieldName + " is required");
        }
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + fieldName + ": " + raw, e);
        }
        if (value <= 0) {
            throw new IllegalArgumentException(fieldName + " must be positive: " + value);
        }
        return value;
    }

    /**
     * Parse an optional non-negative query parameter.
     */
    public long nonNegative(String raw, String fieldName, long defaultValue) {
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + fieldName + ": " + raw, e);
        }
        if (value < 0) {
            throw new IllegalArgumentException(fieldName + " must be non-negative: " + value);
        }
        return value;
    }
}
