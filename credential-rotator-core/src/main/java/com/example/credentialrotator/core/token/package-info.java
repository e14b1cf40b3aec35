/**
 * Identity token sources: a generic OIDC client credentials provider and Microsoft Entra ID
 * providers built on azure-identity.
 */
package com.example.credentialrotator.core.token;
