/** AWS web identity federation through STS {@code AssumeRoleWithWebIdentity}. */
package com.example.credentialrotator.core.aws;
