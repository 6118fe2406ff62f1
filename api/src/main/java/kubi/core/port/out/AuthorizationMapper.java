package kubi.core.port.out;

import java.util.List;

import kubi.core.model.auth.AuthorizationGrant;

/**
 * Port converting directory groups into namespace grants.
 *
 * <p>Must be a pure function of its input. The result is embedded in tokens
 * verbatim, so implementations are responsible for returning a clean,
 * deduplicated list.
 */
public interface AuthorizationMapper {

    List<AuthorizationGrant> map(List<String> groups);
}
