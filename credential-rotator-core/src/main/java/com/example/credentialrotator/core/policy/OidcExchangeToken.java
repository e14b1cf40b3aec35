package com.example.credentialrotator.core.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Identity token source shared by the Azure and GCP federated flows. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OidcExchangeToken(OidcConfig oidc) {}
