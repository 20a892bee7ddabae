package com.scholary.meeting.pipeline.idempotency;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared key-value store with per-key expiry.
 *
 * <p>{@link #setIfAbsent} must be atomic across every worker that shares the store: for a given
 * key at most one caller observes {@code true} until the key is deleted or expires.
 */
public interface IdempotencyStore {

  /**
   * Create the key with the given value and TTL if it does not exist.
   *
   * @return true if this call created the key
   */
  boolean setIfAbsent(String key, String value, Duration ttl);

  /** Read the current value, if any. Never mutates. */
  Optional<String> get(String key);

  /** Overwrite the key unconditionally with a fresh TTL. */
  void set(String key, String value, Duration ttl);

  void delete(String key);
}
