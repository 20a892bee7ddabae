package com.scholary.meeting.pipeline.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Logs pipeline events with fields that can be queried in Kibana. Task context (taskId, stage,
 * meetingId, attempt) stays in MDC for the whole stage run; event fields only for one line.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log stage started event. */
  public void logStageStarted(String stage, String meetingId, int attempt) {
    try {
      MDC.put("event_type", "stage_started");

      logger.info("Stage started: stage={}, meetingId={}, attempt={}", stage, meetingId, attempt);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage completed event. */
  public void logStageCompleted(String stage, String meetingId, String nextStage, long elapsedMs) {
    try {
      MDC.put("event_type", "stage_completed");
      MDC.put("elapsedMs", String.valueOf(elapsedMs));
      if (nextStage != null) {
        MDC.put("nextStage", nextStage);
      }

      logger.info(
          "Stage completed: stage={}, meetingId={}, next={}, elapsed={}ms",
          stage,
          meetingId,
          nextStage != null ? nextStage : "none",
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage skipped event (duplicate delivery or lock held elsewhere). */
  public void logStageSkipped(String stage, String meetingId, String reason) {
    try {
      MDC.put("event_type", "stage_skipped");
      MDC.put("reason", reason);

      logger.info("Stage skipped: stage={}, meetingId={}, reason={}", stage, meetingId, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage retry event. */
  public void logStageRetry(
      String stage, String meetingId, int attempt, int maxRetries, long delayMs, String message) {
    try {
      MDC.put("event_type", "stage_retry");
      MDC.put("maxRetries", String.valueOf(maxRetries));
      MDC.put("delayMs", String.valueOf(delayMs));

      logger.warn(
          "Stage retry: stage={}, meetingId={}, attempt={}/{}, delay={}ms, error={}",
          stage,
          meetingId,
          attempt + 1,
          maxRetries,
          delayMs,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage dead-lettered event. */
  public void logStageDeadLettered(
      String stage, String meetingId, int attempt, String failureType, String message) {
    try {
      MDC.put("event_type", "stage_dead_lettered");
      MDC.put("failureType", failureType);

      logger.error(
          "Stage dead-lettered: stage={}, meetingId={}, attempt={}, failure={}, error={}",
          stage,
          meetingId,
          attempt,
          failureType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Set task context in MDC. */
  public static void setTaskContext(String taskId, String stage, String meetingId, int attempt) {
    MDC.put("taskId", taskId);
    MDC.put("stage", stage);
    MDC.put("meetingId", meetingId);
    MDC.put("attempt", String.valueOf(attempt));
  }

  /** Clear task context from MDC. */
  public static void clearTaskContext() {
    MDC.remove("taskId");
    MDC.remove("stage");
    MDC.remove("meetingId");
    MDC.remove("attempt");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("elapsedMs");
    MDC.remove("nextStage");
    MDC.remove("reason");
    MDC.remove("maxRetries");
    MDC.remove("delayMs");
    MDC.remove("failureType");
  }
}
