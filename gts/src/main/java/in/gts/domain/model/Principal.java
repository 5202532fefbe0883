package in.gts.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Opaque, unforgeable participant identifier.
 *
 * The ledger never authenticates principals; it only compares them for equality.
 * Identifiers are supplied by the hosting environment (gateway header, session, etc.).
 *
 * PUBLIC is the recipient sentinel for offers anyone may act on. Its textual form
 * ("*") is rejected by {@link #of(String)}, so no caller can ever present it.
 */
public final class Principal {

    private static final Pattern ID_PATTERN = Pattern.compile("^[A-Za-z0-9_:.@-]{1,128}$");
    private static final String PUBLIC_ID = "*";

    public static final Principal PUBLIC = new Principal(PUBLIC_ID);

    private final String id;

    private Principal(String id) {
        this.id = id;
    }

    /**
     * Create a real principal.
     *
     * @param id Identifier, 1-128 chars of [A-Za-z0-9_:.@-]
     * @throws IllegalArgumentException if the identifier is malformed
     */
    public static Principal of(String id) {
        if (!isValidId(id)) {
            throw new IllegalArgumentException("Invalid principal identifier: " + id);
        }
        return new Principal(id);
    }

    public static boolean isValidId(String id) {
        return id != null && ID_PATTERN.matcher(id).matches();
    }

    @JsonValue
    public String id() {
        return id;
    }

    public boolean isPublic() {
        return this == PUBLIC;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Principal)) return false;
        return id.equals(((Principal) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return id;
    }
}
