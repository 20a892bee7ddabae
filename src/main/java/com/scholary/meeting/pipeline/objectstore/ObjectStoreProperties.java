package com.scholary.meeting.pipeline.objectstore;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for object storage, bound from "objectstore.*".
 *
 * <p>{@code bucket} is the default bucket for audio references given as a bare key. Leave
 * {@code endpoint} empty for AWS itself; leave the keys empty to use the default AWS credential
 * chain.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    String endpoint,
    String accessKey,
    String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess) {

  public boolean hasStaticCredentials() {
    return accessKey != null && !accessKey.isBlank() && secretKey != null && !secretKey.isBlank();
  }
}
