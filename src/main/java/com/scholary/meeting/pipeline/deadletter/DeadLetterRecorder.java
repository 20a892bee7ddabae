package com.scholary.meeting.pipeline.deadletter;

import java.util.List;

/**
 * Append-only, capped list of abandoned tasks. When full, the oldest record is dropped.
 */
public interface DeadLetterRecorder {

  void record(DeadLetterRecord deadLetter);

  /** Up to {@code limit} records, newest first. */
  List<DeadLetterRecord> recent(int limit);

  long size();
}
