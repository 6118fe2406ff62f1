package kubi.core.model.auth;

import java.util.Locale;
import java.util.Optional;

/**
 * Role granted on a namespace.
 */
public enum NamespaceRole {
    ADMIN,
    WRITE,
    READ;

    /**
     * Lower-case form used in token claims and group names.
     */
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a role from its wire value, ignoring case.
     *
     * @param value the role name, e.g. {@code "write"}
     * @return the role, or empty if the value is not a known role
     */
    public static Optional<NamespaceRole> fromWireValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (NamespaceRole role : values()) {
            if (role.wireValue().equalsIgnoreCase(value.trim())) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
