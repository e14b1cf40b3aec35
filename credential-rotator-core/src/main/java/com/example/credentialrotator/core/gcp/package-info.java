/** GCP workload identity federation: STS token exchange and service account impersonation. */
package com.example.credentialrotator.core.gcp;
