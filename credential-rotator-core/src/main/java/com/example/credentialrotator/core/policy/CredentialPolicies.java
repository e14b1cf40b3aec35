package com.example.credentialrotator.core.policy;

import com.example.credentialrotator.core.ConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * Reads credential policies from their Kubernetes resource JSON.
 *
 * <pre>{@code
 * {
 *   "metadata": {"name": "my-policy", "namespace": "default"},
 *   "spec": {"type": "AWSCredentials", "awsCredentials": {...}}
 * }
 * }</pre>
 */
public final class CredentialPolicies {

  private static final ObjectMapper MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private CredentialPolicies() {}

  /**
   * Parses a policy resource.
   *
   * @param json resource JSON
   * @return the policy
   * @throws ConfigurationException if the document is malformed or lacks name, namespace or type
   */
  public static CredentialPolicy read(final String json) {
    try {
      return toPolicy(MAPPER.readTree(json));
    } catch (final JsonProcessingException e) {
      throw new ConfigurationException("Failed to parse credential policy: " + e.getMessage(), e);
    }
  }

  /** Parses a policy resource from a stream. */
  public static CredentialPolicy read(final InputStream in) {
    try {
      return toPolicy(MAPPER.readTree(in));
    } catch (final JsonProcessingException e) {
      throw new ConfigurationException("Failed to parse credential policy: " + e.getMessage(), e);
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to read credential policy", e);
    }
  }

  private static CredentialPolicy toPolicy(final JsonNode root) throws JsonProcessingException {
    final var metadata = root.path("metadata");
    final var name = text(metadata, "name").orElseThrow(() -> missing("metadata.name"));
    final var namespace =
        text(metadata, "namespace").orElseThrow(() -> missing("metadata.namespace"));
    final var spec = root.path("spec");
    final var type =
        MAPPER.treeToValue(
            Optional.ofNullable(spec.get("type")).orElseThrow(() -> missing("spec.type")),
            ProviderType.class);
    return new CredentialPolicy(
        namespace,
        name,
        type,
        section(spec, "awsCredentials", AwsCredentials.class),
        section(spec, "azureCredentials", AzureCredentials.class),
        section(spec, "gcpCredentials", GcpCredentials.class));
  }

  private static <T> T section(final JsonNode spec, final String field, final Class<T> type)
      throws JsonProcessingException {
    final var node = spec.get(field);
    return node == null || node.isNull() ? null : MAPPER.treeToValue(node, type);
  }

  private static Optional<String> text(final JsonNode node, final String field) {
    return Optional.ofNullable(node.get(field))
        .map(JsonNode::asText)
        .filter(value -> !value.isBlank());
  }

  private static ConfigurationException missing(final String field) {
    return new ConfigurationException("credential policy is missing " + field);
  }
}
