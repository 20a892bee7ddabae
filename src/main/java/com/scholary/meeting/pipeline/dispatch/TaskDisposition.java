package com.scholary.meeting.pipeline.dispatch;

import com.scholary.meeting.pipeline.pipeline.PipelineStage;
import java.time.Duration;

/** What the transport should do with a message once its stage has run. */
public record TaskDisposition(Action action, PipelineStage nextStage, Duration retryDelay) {

  public enum Action {
    /** Done; nothing follows. */
    ACK,
    /** Done; enqueue {@code nextStage}. */
    ACK_AND_CHAIN,
    /** Failed transiently; deliver again after {@code retryDelay}. */
    RETRY,
    /** Failed for good. */
    DEAD_LETTER
  }

  public static TaskDisposition ack() {
    return new TaskDisposition(Action.ACK, null, null);
  }

  public static TaskDisposition ackAndChain(PipelineStage next) {
    return new TaskDisposition(Action.ACK_AND_CHAIN, next, null);
  }

  public static TaskDisposition retry(Duration delay) {
    return new TaskDisposition(Action.RETRY, null, delay);
  }

  public static TaskDisposition deadLetter() {
    return new TaskDisposition(Action.DEAD_LETTER, null, null);
  }
}
