package com.scholary.meeting.pipeline.pipeline.stage;

import com.scholary.meeting.pipeline.idempotency.CaffeineIdempotencyStore;
import com.scholary.meeting.pipeline.idempotency.IdempotencyGuardFactory;
import com.scholary.meeting.pipeline.idempotency.IdempotencyLedger;
import com.scholary.meeting.pipeline.meeting.Meeting;
import com.scholary.meeting.pipeline.meeting.MeetingRepository;
import com.scholary.meeting.pipeline.meeting.MeetingStatus;
import java.time.Duration;
import java.time.Instant;

/** Shared wiring for stage tests: real in-memory stores, no transport. */
final class StageFixtures {

  private StageFixtures() {}

  static IdempotencyGuardFactory guards() {
    IdempotencyLedger ledger =
        new IdempotencyLedger(
            new CaffeineIdempotencyStore(1000), Duration.ofHours(1), Duration.ofHours(24));
    return new IdempotencyGuardFactory(ledger, ledger);
  }

  static Meeting meeting(String id, MeetingStatus status) {
    return new Meeting(id, "Weekly sync", "s3://meetings/" + id + ".mp3", null, status, Instant.now());
  }

  static void saveMeeting(MeetingRepository repository, String id, MeetingStatus status) {
    repository.save(meeting(id, status));
  }
}
