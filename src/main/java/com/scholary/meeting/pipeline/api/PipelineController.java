package com.scholary.meeting.pipeline.api;

import com.scholary.meeting.pipeline.deadletter.DeadLetterRecord;
import com.scholary.meeting.pipeline.deadletter.DeadLetterRecorder;
import com.scholary.meeting.pipeline.dispatch.DispatchException;
import com.scholary.meeting.pipeline.meeting.InsightsRepository;
import com.scholary.meeting.pipeline.meeting.Meeting;
import com.scholary.meeting.pipeline.meeting.MeetingRepository;
import com.scholary.meeting.pipeline.meeting.TranscriptChunkRepository;
import com.scholary.meeting.pipeline.meeting.TranscriptRepository;
import com.scholary.meeting.pipeline.monitoring.KibanaUrlGenerator;
import com.scholary.meeting.pipeline.service.PipelineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator API for the meeting pipeline.
 *
 * <ul>
 *   <li>Register a meeting and start processing (returns immediately)
 *   <li>Meeting status polling
 *   <li>Manual re-drive of meetings in error
 *   <li>Recent dead letters
 * </ul>
 */
@RestController
@Tag(name = "Pipeline", description = "Meeting processing pipeline operations")
public class PipelineController {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineController.class);

  static final int MAX_DEAD_LETTER_LIMIT = 1000;

  private final PipelineService pipelineService;
  private final MeetingRepository meetingRepository;
  private final TranscriptRepository transcriptRepository;
  private final InsightsRepository insightsRepository;
  private final TranscriptChunkRepository chunkRepository;
  private final DeadLetterRecorder deadLetterRecorder;
  private final KibanaUrlGenerator kibanaUrlGenerator;

  public PipelineController(
      PipelineService pipelineService,
      MeetingRepository meetingRepository,
      TranscriptRepository transcriptRepository,
      InsightsRepository insightsRepository,
      TranscriptChunkRepository chunkRepository,
      DeadLetterRecorder deadLetterRecorder,
      KibanaUrlGenerator kibanaUrlGenerator) {
    this.pipelineService = pipelineService;
    this.meetingRepository = meetingRepository;
    this.transcriptRepository = transcriptRepository;
    this.insightsRepository = insightsRepository;
    this.chunkRepository = chunkRepository;
    this.deadLetterRecorder = deadLetterRecorder;
    this.kibanaUrlGenerator = kibanaUrlGenerator;
  }

  @PostMapping("/api/meetings")
  @Operation(
      summary = "Register meeting",
      description = "Create a pending meeting and enqueue transcription; poll the status endpoint")
  public ResponseEntity<MeetingAcceptedResponse> register(
      @Valid @RequestBody MeetingRequest request) {
    Meeting meeting = pipelineService.register(request.title(), request.audioLocation());
    return ResponseEntity.accepted()
        .body(
            new MeetingAcceptedResponse(
                meeting.id(), meeting.status(), kibanaUrlGenerator.generateMeetingUrl(meeting.id())));
  }

  @GetMapping("/api/meetings/{id}")
  @Operation(summary = "Get meeting status", description = "Pipeline status and available outputs")
  public ResponseEntity<MeetingStatusResponse> getMeeting(@PathVariable String id) {
    return meetingRepository
        .findById(id)
        .map(
            meeting ->
                ResponseEntity.ok(
                    new MeetingStatusResponse(
                        meeting.id(),
                        meeting.title(),
                        meeting.status(),
                        meeting.durationSeconds(),
                        transcriptRepository.findByMeetingId(id).isPresent(),
                        insightsRepository.findByMeetingId(id).isPresent(),
                        chunkRepository.countByMeetingId(id),
                        kibanaUrlGenerator.generateMeetingUrl(id))))
        .orElse(ResponseEntity.notFound().build());
  }

  @PostMapping("/api/meetings/{id}/redrive")
  @Operation(
      summary = "Re-drive meeting",
      description = "Restart processing of a meeting in error from the first stage")
  public ResponseEntity<Void> redrive(@PathVariable String id) {
    switch (pipelineService.redrive(id)) {
      case REDRIVEN:
        return ResponseEntity.accepted().build();
      case NOT_FOUND:
        return ResponseEntity.notFound().build();
      case NOT_IN_ERROR:
      default:
        return ResponseEntity.status(HttpStatus.CONFLICT).build();
    }
  }

  @GetMapping("/api/dead-letters")
  @Operation(summary = "List dead letters", description = "Most recent abandoned tasks first")
  public List<DeadLetterRecord> deadLetters(@RequestParam(defaultValue = "50") int limit) {
    return deadLetterRecorder.recent(Math.min(Math.max(limit, 0), MAX_DEAD_LETTER_LIMIT));
  }

  @ExceptionHandler(DispatchException.class)
  public ResponseEntity<Void> dispatchFailed(DispatchException e) {
    LOGGER.error("Could not enqueue pipeline task", e);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
  }
}
