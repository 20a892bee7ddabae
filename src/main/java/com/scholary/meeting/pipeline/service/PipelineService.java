package com.scholary.meeting.pipeline.service;

import com.scholary.meeting.pipeline.dispatch.DispatchException;
import com.scholary.meeting.pipeline.dispatch.TaskDispatcher;
import com.scholary.meeting.pipeline.idempotency.IdempotencyGuardFactory;
import com.scholary.meeting.pipeline.meeting.Meeting;
import com.scholary.meeting.pipeline.meeting.MeetingRepository;
import com.scholary.meeting.pipeline.pipeline.PipelineGraph;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry points into the pipeline: register a meeting and start its first stage, or re-drive a
 * meeting that ended in error.
 */
@Service
public class PipelineService {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineService.class);

  public enum RedriveResult {
    REDRIVEN,
    NOT_FOUND,
    NOT_IN_ERROR
  }

  private final MeetingRepository meetingRepository;
  private final IdempotencyGuardFactory guards;
  private final TaskDispatcher dispatcher;
  private final PipelineGraph graph;

  public PipelineService(
      MeetingRepository meetingRepository,
      IdempotencyGuardFactory guards,
      TaskDispatcher dispatcher,
      PipelineGraph graph) {
    this.meetingRepository = meetingRepository;
    this.guards = guards;
    this.dispatcher = dispatcher;
    this.graph = graph;
  }

  /**
   * Create a pending meeting and enqueue its first stage.
   *
   * @throws DispatchException if the task could not be enqueued; the meeting stays pending
   */
  public Meeting register(String title, String audioLocation) {
    Meeting meeting = Meeting.pending(UUID.randomUUID().toString(), title, audioLocation);
    meetingRepository.save(meeting);
    LOGGER.info("Registered meeting: meetingId={}, audio={}", meeting.id(), audioLocation);

    dispatcher.enqueue(graph.first(), meeting.id());
    return meeting;
  }

  /**
   * Run the whole chain again for a meeting in ERROR: error → pending, completion memos forgotten,
   * first stage enqueued. If the enqueue fails the meeting goes back to ERROR, so it can be
   * re-driven again.
   *
   * @throws DispatchException if the first stage could not be enqueued
   */
  public RedriveResult redrive(String meetingId) {
    if (meetingRepository.findById(meetingId).isEmpty()) {
      return RedriveResult.NOT_FOUND;
    }
    if (!meetingRepository.resetForRedrive(meetingId)) {
      return RedriveResult.NOT_IN_ERROR;
    }

    guards.forgetAll(meetingId);
    try {
      dispatcher.enqueue(graph.first(), meetingId);
    } catch (DispatchException e) {
      meetingRepository.abortRedrive(meetingId);
      throw e;
    }

    LOGGER.info("Re-drove meeting: meetingId={}", meetingId);
    return RedriveResult.REDRIVEN;
  }
}
