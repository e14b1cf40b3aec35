package com.example.credentialrotator.core.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Optional;

/**
 * GCP section of a credential policy.
 *
 * @param projectName project the gateway calls Vertex AI in; also hosts the impersonated service
 *     account
 * @param region GCP region
 * @param workloadIdentityFederationConfig federation settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GcpCredentials(
    String projectName,
    String region,
    WorkloadIdentityFederationConfig workloadIdentityFederationConfig) {

  public Optional<WorkloadIdentityFederationConfig> federation() {
    return Optional.ofNullable(workloadIdentityFederationConfig);
  }

  /**
   * Workload identity federation settings.
   *
   * @param projectId project number or id owning the workload identity pool
   * @param workloadIdentityPoolName pool name
   * @param workloadIdentityProviderName provider name within the pool
   * @param oidcExchangeToken identity token source
   * @param serviceAccountImpersonation optional service account to impersonate after the exchange
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record WorkloadIdentityFederationConfig(
      @JsonProperty("projectID") String projectId,
      String workloadIdentityPoolName,
      String workloadIdentityProviderName,
      OidcExchangeToken oidcExchangeToken,
      ServiceAccountImpersonation serviceAccountImpersonation) {

    public Optional<ServiceAccountImpersonation> impersonation() {
      return Optional.ofNullable(serviceAccountImpersonation);
    }

    /** Full resource name of the workload identity provider, used as STS audience. */
    public String audience() {
      return String.format(
          "//iam.googleapis.com/projects/%s/locations/global/workloadIdentityPools/%s/providers/%s",
          projectId, workloadIdentityPoolName, workloadIdentityProviderName);
    }
  }

  /** @param serviceAccountName account id, without domain */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ServiceAccountImpersonation(String serviceAccountName) {

    /** Service account email within {@code projectName}. */
    public String email(final String projectName) {
      return String.format("%s@%s.iam.gserviceaccount.com", serviceAccountName, projectName);
    }
  }
}
