package com.scholary.meeting.pipeline.meeting;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * In-memory store of meeting records.
 *
 * <p>Status changes go through {@link #transition}, which applies the {@link MeetingStatus} rules
 * atomically per meeting, so a status never regresses even when stages race on duplicates.
 */
@Repository
public class MeetingRepository {

  private static final Logger LOGGER = LoggerFactory.getLogger(MeetingRepository.class);

  private final ConcurrentMap<String, Meeting> meetings = new ConcurrentHashMap<>();

  public void save(Meeting meeting) {
    meetings.put(meeting.id(), meeting);
  }

  public Optional<Meeting> findById(String meetingId) {
    return Optional.ofNullable(meetings.get(meetingId));
  }

  /**
   * Move a meeting to {@code target} if the state machine allows it.
   *
   * @return true if the meeting is now in {@code target}, false if it is missing or the transition
   *     is not allowed
   */
  public boolean transition(String meetingId, MeetingStatus target) {
    AtomicBoolean applied = new AtomicBoolean(false);
    meetings.computeIfPresent(
        meetingId,
        (id, current) -> {
          if (!current.status().canTransitionTo(target)) {
            LOGGER.warn(
                "Rejected status transition: meetingId={}, from={}, to={}",
                id,
                current.status().value(),
                target.value());
            return current;
          }
          applied.set(true);
          if (current.status() == target) {
            return current;
          }
          LOGGER.info(
              "Meeting status changed: meetingId={}, from={}, to={}",
              id,
              current.status().value(),
              target.value());
          return current.withStatus(target);
        });
    return applied.get();
  }

  /**
   * Reset an ERROR meeting to PENDING for a manual re-drive.
   *
   * @return true if the meeting was in ERROR and is now PENDING
   */
  public boolean resetForRedrive(String meetingId) {
    AtomicBoolean applied = new AtomicBoolean(false);
    meetings.computeIfPresent(
        meetingId,
        (id, current) -> {
          if (!current.status().canRedrive()) {
            return current;
          }
          applied.set(true);
          LOGGER.info("Meeting reset for re-drive: meetingId={}", id);
          return current.withStatus(MeetingStatus.PENDING);
        });
    return applied.get();
  }

  /**
   * Put a meeting back into ERROR after its re-drive could not be dispatched. Only a meeting still
   * in PENDING is touched, so a stage that already picked it up keeps its progress.
   *
   * @return true if the meeting was PENDING and is now ERROR
   */
  public boolean abortRedrive(String meetingId) {
    AtomicBoolean applied = new AtomicBoolean(false);
    meetings.computeIfPresent(
        meetingId,
        (id, current) -> {
          if (current.status() != MeetingStatus.PENDING) {
            return current;
          }
          applied.set(true);
          LOGGER.warn("Re-drive aborted, meeting back in error: meetingId={}", id);
          return current.withStatus(MeetingStatus.ERROR);
        });
    return applied.get();
  }

  public void updateDuration(String meetingId, double durationSeconds) {
    meetings.computeIfPresent(meetingId, (id, current) -> current.withDuration(durationSeconds));
  }
}
