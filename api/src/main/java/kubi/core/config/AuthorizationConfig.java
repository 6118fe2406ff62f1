package kubi.core.config;

import java.util.Set;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for turning directory groups into namespace grants.
 *
 * <p>Configuration prefix: {@code kubi.authorization}
 */
@ConfigMapping(prefix = "kubi.authorization")
public interface AuthorizationConfig {

    /**
     * Case-insensitive pattern a group name must match to produce a grant.
     *
     * <p>Must define the named groups {@code namespace} and {@code role}.
     */
    @WithName("group-pattern")
    @WithDefault("^DL_KUB_(?<namespace>[a-z0-9-]+)_(?<role>admin|write|read)$")
    String groupPattern();

    /**
     * Namespaces that are never granted, whatever the groups say.
     */
    @WithDefault("kube-system,kube-public")
    Set<String> blacklist();
}
