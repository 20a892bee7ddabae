package com.scholary.meeting.pipeline.deadletter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/** Dead letters in a bounded deque, newest at the head. Lost on restart. */
public class InMemoryDeadLetterRecorder implements DeadLetterRecorder {

  private final Deque<DeadLetterRecord> records = new ArrayDeque<>();
  private final int capacity;

  public InMemoryDeadLetterRecorder(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
  }

  @Override
  public synchronized void record(DeadLetterRecord deadLetter) {
    records.addFirst(deadLetter);
    while (records.size() > capacity) {
      records.removeLast();
    }
  }

  @Override
  public synchronized List<DeadLetterRecord> recent(int limit) {
    return records.stream().limit(Math.max(limit, 0)).toList();
  }

  @Override
  public synchronized long size() {
    return records.size();
  }
}
