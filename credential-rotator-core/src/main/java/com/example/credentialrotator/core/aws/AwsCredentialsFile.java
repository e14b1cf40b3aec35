package com.example.credentialrotator.core.aws;

/**
 * One profile of a shared AWS credentials file, as read by the AWS SDKs.
 *
 * @param profile profile name
 * @param accessKeyId access key id
 * @param secretAccessKey secret access key
 * @param sessionToken session token of temporary credentials
 * @param region default region of the profile
 */
public record AwsCredentialsFile(
    String profile,
    String accessKeyId,
    String secretAccessKey,
    String sessionToken,
    String region) {

  public static final String DEFAULT_PROFILE = "default";

  /** Renders the profile in INI format. */
  public String render() {
    return String.format(
        "[%s]\naws_access_key_id = %s\naws_secret_access_key = %s\naws_session_token = %s\n"
            + "region = %s\n",
        profile, accessKeyId, secretAccessKey, sessionToken, region);
  }

  @Override
  public String toString() {
    return "AwsCredentialsFile[profile=" + profile + ", region=" + region + "]";
  }
}
