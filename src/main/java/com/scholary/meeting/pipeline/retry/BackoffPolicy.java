package com.scholary.meeting.pipeline.retry;

import java.time.Duration;

/**
 * Exponential backoff with a cap, plus the attempt budget for a stage.
 *
 * <p>{@code delay(attempt) = min(baseDelay * 2^attempt, maxDelay)} with a zero-indexed attempt.
 * The attempt count travels with the task message; this class keeps no state.
 */
public final class BackoffPolicy {

  private final Duration baseDelay;
  private final Duration maxDelay;
  private final int maxRetries;

  public BackoffPolicy(Duration baseDelay, Duration maxDelay, int maxRetries) {
    if (baseDelay.isNegative() || baseDelay.isZero()) {
      throw new IllegalArgumentException("baseDelay must be positive: " + baseDelay);
    }
    if (maxDelay.compareTo(baseDelay) < 0) {
      throw new IllegalArgumentException(
          "maxDelay must be >= baseDelay: " + maxDelay + " < " + baseDelay);
    }
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
    }
    this.baseDelay = baseDelay;
    this.maxDelay = maxDelay;
    this.maxRetries = maxRetries;
  }

  /**
   * Delay before redelivering a task whose attempt {@code attempt} failed.
   *
   * @param attempt zero-indexed attempt number
   * @return the backoff delay, never more than {@code maxDelay}
   */
  public Duration delay(int attempt) {
    if (attempt < 0) {
      throw new IllegalArgumentException("attempt must be >= 0: " + attempt);
    }
    long baseMillis = baseDelay.toMillis();
    long maxMillis = maxDelay.toMillis();
    // 2^attempt overflows long past 62 shifts, and the cap is reached long before that anyway
    if (attempt >= 62 || baseMillis > (maxMillis >> attempt)) {
      return maxDelay;
    }
    return Duration.ofMillis(Math.min(baseMillis << attempt, maxMillis));
  }

  /** True once a failed attempt has used up the retry budget and must be dead-lettered. */
  public boolean isExhausted(int attempt) {
    return attempt >= maxRetries;
  }

  public int maxRetries() {
    return maxRetries;
  }

  public Duration baseDelay() {
    return baseDelay;
  }

  public Duration maxDelay() {
    return maxDelay;
  }

  @Override
  public String toString() {
    return String.format(
        "BackoffPolicy[base=%s, max=%s, maxRetries=%d]", baseDelay, maxDelay, maxRetries);
  }
}
