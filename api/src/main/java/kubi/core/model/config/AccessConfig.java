package kubi.core.model.config;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Kubeconfig document handed to kubectl.
 *
 * <p>Field names follow the kubeconfig format, so the document can be
 * serialized as-is and used out of the box.
 *
 * @param apiVersion     always {@code v1}
 * @param kind           always {@code Config}
 * @param clusters       the cluster entries
 * @param contexts       the context entries
 * @param currentContext the context kubectl selects by default
 * @param users          the user entries holding credentials
 */
@JsonPropertyOrder({"apiVersion", "kind", "clusters", "contexts", "current-context", "users"})
public record AccessConfig(
        @JsonProperty("apiVersion") String apiVersion,
        @JsonProperty("kind") String kind,
        @JsonProperty("clusters") List<NamedCluster> clusters,
        @JsonProperty("contexts") List<NamedContext> contexts,
        @JsonProperty("current-context") String currentContext,
        @JsonProperty("users") List<NamedUser> users) {

    public AccessConfig {
        clusters = clusters == null ? List.of() : List.copyOf(clusters);
        contexts = contexts == null ? List.of() : List.copyOf(contexts);
        users = users == null ? List.of() : List.copyOf(users);
    }

    public record NamedCluster(@JsonProperty("name") String name, @JsonProperty("cluster") Cluster cluster) {}

    public record Cluster(
            @JsonProperty("server") String server,
            @JsonProperty("certificate-authority-data") String certificateAuthorityData) {}

    public record NamedContext(@JsonProperty("name") String name, @JsonProperty("context") Context context) {}

    public record Context(@JsonProperty("cluster") String cluster, @JsonProperty("user") String user) {}

    public record NamedUser(@JsonProperty("name") String name, @JsonProperty("user") User user) {}

    public record User(@JsonProperty("token") String token) {}
}
