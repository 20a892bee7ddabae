package com.scholary.meeting.pipeline.objectstore;

/**
 * Where a recording lives: {@code s3://bucket/key}, or a bare key in the default bucket.
 */
public record AudioLocation(String bucket, String key) {

  private static final String S3_SCHEME = "s3://";

  public AudioLocation {
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalArgumentException("Audio location has no bucket");
    }
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("Audio location has no key");
    }
  }

  /**
   * Parse an audio reference.
   *
   * @throws IllegalArgumentException if the reference is blank or names no key
   */
  public static AudioLocation parse(String reference, String defaultBucket) {
    if (reference == null || reference.isBlank()) {
      throw new IllegalArgumentException("Audio reference is empty");
    }
    String trimmed = reference.strip();
    if (!trimmed.startsWith(S3_SCHEME)) {
      return new AudioLocation(defaultBucket, stripLeadingSlash(trimmed));
    }
    String path = trimmed.substring(S3_SCHEME.length());
    int slash = path.indexOf('/');
    if (slash <= 0) {
      throw new IllegalArgumentException("Audio reference names no key: " + reference);
    }
    return new AudioLocation(path.substring(0, slash), path.substring(slash + 1));
  }

  /** File name part of the key, for temp files and multipart uploads. */
  public String fileName() {
    int slash = key.lastIndexOf('/');
    return slash >= 0 ? key.substring(slash + 1) : key;
  }

  @Override
  public String toString() {
    return S3_SCHEME + bucket + "/" + key;
  }

  private static String stripLeadingSlash(String key) {
    return key.startsWith("/") ? key.substring(1) : key;
  }
}
