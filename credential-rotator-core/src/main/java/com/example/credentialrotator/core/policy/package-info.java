/** Credential policy model, bound from the policy resource JSON with Jackson. */
package com.example.credentialrotator.core.policy;
