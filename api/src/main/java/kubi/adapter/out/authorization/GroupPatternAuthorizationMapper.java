package kubi.adapter.out.authorization;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import kubi.core.config.AuthorizationConfig;
import kubi.core.model.auth.AuthorizationGrant;
import kubi.core.model.auth.NamespaceRole;
import kubi.core.model.common.ConfigurationInvalidException;
import kubi.core.port.out.AuthorizationMapper;

/**
 * Maps directory groups to namespace grants with a configurable pattern.
 *
 * <p>With the default pattern, group {@code DL_KUB_PAYMENTS-DEV_WRITE} grants
 * role {@code write} on namespace {@code payments-dev}. Groups that do not
 * match are ignored. When several groups name the same namespace, the first
 * one wins. Blacklisted namespaces are never granted.
 */
@ApplicationScoped
public class GroupPatternAuthorizationMapper implements AuthorizationMapper {

    private static final Logger LOG = Logger.getLogger(GroupPatternAuthorizationMapper.class);

    static final String NAMESPACE_GROUP = "namespace";
    static final String ROLE_GROUP = "role";

    private final Pattern groupPattern;
    private final Set<String> blacklist;

    @Inject
    public GroupPatternAuthorizationMapper(AuthorizationConfig config) {
        this(config.groupPattern(), config.blacklist());
    }

    GroupPatternAuthorizationMapper(String groupPattern, Set<String> blacklist) {
        this.groupPattern = compile(groupPattern);
        this.blacklist = blacklist.stream()
                .map(String::trim)
                .filter(ns -> !ns.isEmpty())
                .map(ns -> ns.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public List<AuthorizationGrant> map(List<String> groups) {
        final var seen = new LinkedHashSet<String>();
        final var grants = new ArrayList<AuthorizationGrant>();

        for (String group : groups) {
            if (group == null) {
                continue;
            }
            final Matcher matcher = groupPattern.matcher(group.trim());
            if (!matcher.matches()) {
                continue;
            }

            final var namespace = matcher.group(NAMESPACE_GROUP).toLowerCase(Locale.ROOT);
            final var role = NamespaceRole.fromWireValue(matcher.group(ROLE_GROUP));
            if (role.isEmpty()) {
                LOG.debugv("Group {0} names an unknown role, skipping", group);
                continue;
            }
            if (blacklist.contains(namespace)) {
                LOG.debugv("Group {0} targets blacklisted namespace {1}, skipping", group, namespace);
                continue;
            }
            if (seen.add(namespace)) {
                grants.add(new AuthorizationGrant(namespace, role.get()));
            }
        }
        return grants;
    }

    private static Pattern compile(String regex) {
        final Pattern pattern;
        try {
            pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationInvalidException("Invalid kubi.authorization.group-pattern: " + e.getMessage(), e);
        }
        if (!regex.contains("(?<" + NAMESPACE_GROUP + ">") || !regex.contains("(?<" + ROLE_GROUP + ">")) {
            throw new ConfigurationInvalidException(
                    "kubi.authorization.group-pattern must define the named groups 'namespace' and 'role'");
        }
        return pattern;
    }
}
