package com.scholary.meeting.pipeline.dispatch;

import com.scholary.meeting.pipeline.retry.BackoffPolicy;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Names and routing keys of the RabbitMQ objects the pipeline uses.
 *
 * <pre>
 * exchange (direct)
 *   "work"          → work queue        (dead-letters to "dead")
 *   "retry.{ms}"    → retry queue {ms}  (x-message-ttl = ms, dead-letters to "work")
 *   "dead"          → dead-letter queue
 * </pre>
 *
 * <p>There is one retry queue per distinct backoff delay, so every message in a retry queue has
 * the same TTL and they expire in order.
 */
public class RabbitTopology {

  public static final String WORK_ROUTING_KEY = "work";
  public static final String DEAD_LETTER_ROUTING_KEY = "dead";
  private static final String RETRY_ROUTING_PREFIX = "retry.";

  private final String exchange;
  private final String workQueue;
  private final String retryQueuePrefix;
  private final String deadLetterQueue;
  private final Set<Duration> retryDelays = new LinkedHashSet<>();

  public RabbitTopology(
      String exchange,
      String workQueue,
      String retryQueuePrefix,
      String deadLetterQueue,
      BackoffPolicy backoffPolicy) {
    this.exchange = exchange;
    this.workQueue = workQueue;
    this.retryQueuePrefix = retryQueuePrefix;
    this.deadLetterQueue = deadLetterQueue;
    for (int attempt = 0; attempt < backoffPolicy.maxRetries(); attempt++) {
      retryDelays.add(backoffPolicy.delay(attempt));
    }
  }

  public String exchange() {
    return exchange;
  }

  public String workQueue() {
    return workQueue;
  }

  public String deadLetterQueue() {
    return deadLetterQueue;
  }

  /** Every delay the backoff policy can produce, in attempt order without repeats. */
  public Set<Duration> retryDelays() {
    return retryDelays;
  }

  public String retryQueue(Duration delay) {
    return retryQueuePrefix + delay.toMillis();
  }

  /**
   * @throws IllegalArgumentException if no retry queue exists for {@code delay}
   */
  public String retryRoutingKey(Duration delay) {
    if (!retryDelays.contains(delay)) {
      throw new IllegalArgumentException("No retry queue declared for delay " + delay);
    }
    return RETRY_ROUTING_PREFIX + delay.toMillis();
  }
}
