package kubi.core.model.auth;

/**
 * Permission to act on one namespace with one role.
 *
 * @param namespace the Kubernetes namespace
 * @param role      the role held on that namespace
 */
public record AuthorizationGrant(String namespace, NamespaceRole role) {
    public AuthorizationGrant {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("Namespace cannot be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("Role cannot be null");
        }
    }
}
