package com.example.credentialrotator.core.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Authentication mechanism a credential policy configures for an upstream provider. */
public enum ProviderType {
  @JsonProperty("APIKey")
  API_KEY(false),
  @JsonProperty("AWSCredentials")
  AWS_CREDENTIALS(true),
  @JsonProperty("AzureAPIKey")
  AZURE_API_KEY(false),
  @JsonProperty("AnthropicAPIKey")
  ANTHROPIC_API_KEY(false),
  @JsonProperty("AzureCredentials")
  AZURE_CREDENTIALS(true),
  @JsonProperty("GCPCredentials")
  GCP_CREDENTIALS(true);

  private final boolean rotatable;

  ProviderType(final boolean rotatable) {
    this.rotatable = rotatable;
  }

  /**
   * Whether credentials of this type are short-lived and may need rotation. Static API keys never
   * do.
   */
  public boolean rotatable() {
    return rotatable;
  }
}
