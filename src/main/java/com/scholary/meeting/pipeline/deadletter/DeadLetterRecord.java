package com.scholary.meeting.pipeline.deadletter;

import java.time.Instant;

/** A task the pipeline gave up on. {@code traceback} is the failure's stack trace, if any. */
public record DeadLetterRecord(
    String taskId,
    String stageName,
    String meetingId,
    int attempt,
    String error,
    String traceback,
    Instant timestamp) {}
