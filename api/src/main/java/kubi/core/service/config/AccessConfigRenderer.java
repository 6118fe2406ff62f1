package kubi.core.service.config;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import kubi.core.model.common.ServiceContext;
import kubi.core.model.config.AccessConfig;

/**
 * Builds kubeconfig documents around an issued token.
 *
 * <p>Only call this after a token has been issued successfully. Documents are
 * built fresh for each request.
 */
@ApplicationScoped
public class AccessConfigRenderer {

    static final String API_VERSION = "v1";
    static final String KIND = "Config";

    private final String clusterName;
    private final YAMLMapper yamlMapper;

    @Inject
    public AccessConfigRenderer(ServiceContext context) {
        this(context.clusterName());
    }

    AccessConfigRenderer(String clusterName) {
        this.clusterName = clusterName;
        this.yamlMapper = YAMLMapper.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .build();
    }

    /**
     * Build the kubeconfig for a user.
     *
     * @param username        the authenticated username, also the kubeconfig user name
     * @param token           the issued token
     * @param clusterEndpoint the API server URL
     * @param caDataBase64    base64-encoded PEM of the cluster CA
     * @return the document
     */
    public AccessConfig render(String username, String token, String clusterEndpoint, String caDataBase64) {
        final var contextName = contextName(username);
        return new AccessConfig(
                API_VERSION,
                KIND,
                List.of(new AccessConfig.NamedCluster(
                        clusterName, new AccessConfig.Cluster(clusterEndpoint, caDataBase64))),
                List.of(new AccessConfig.NamedContext(contextName, new AccessConfig.Context(clusterName, username))),
                contextName,
                List.of(new AccessConfig.NamedUser(username, new AccessConfig.User(token))));
    }

    /**
     * Serialize a document to YAML.
     *
     * @throws IllegalStateException if serialization fails, which indicates a bug
     */
    public String toYaml(AccessConfig config) {
        try {
            return yamlMapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize kubeconfig", e);
        }
    }

    String contextName(String username) {
        return clusterName + "-" + username;
    }
}
