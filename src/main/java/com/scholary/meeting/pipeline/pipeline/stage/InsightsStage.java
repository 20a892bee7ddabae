package com.scholary.meeting.pipeline.pipeline.stage;

import com.scholary.meeting.pipeline.idempotency.IdempotencyGuardFactory;
import com.scholary.meeting.pipeline.insights.InsightExtractor;
import com.scholary.meeting.pipeline.meeting.InsightsRepository;
import com.scholary.meeting.pipeline.meeting.MeetingInsights;
import com.scholary.meeting.pipeline.meeting.MeetingRepository;
import com.scholary.meeting.pipeline.meeting.MeetingStatus;
import com.scholary.meeting.pipeline.meeting.Transcript;
import com.scholary.meeting.pipeline.meeting.TranscriptRepository;
import com.scholary.meeting.pipeline.pipeline.AbstractStageHandler;
import com.scholary.meeting.pipeline.pipeline.PermanentStageException;
import com.scholary.meeting.pipeline.pipeline.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Stage 2: summary, action items and topics. Leaves the meeting status alone. */
@Component
public class InsightsStage extends AbstractStageHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(InsightsStage.class);

  private final TranscriptRepository transcriptRepository;
  private final InsightsRepository insightsRepository;
  private final InsightExtractor extractor;

  public InsightsStage(
      IdempotencyGuardFactory guards,
      MeetingRepository meetingRepository,
      TranscriptRepository transcriptRepository,
      InsightsRepository insightsRepository,
      InsightExtractor extractor) {
    super(guards, meetingRepository);
    this.transcriptRepository = transcriptRepository;
    this.insightsRepository = insightsRepository;
    this.extractor = extractor;
  }

  @Override
  public PipelineStage stage() {
    return PipelineStage.INSIGHTS;
  }

  @Override
  protected void execute(String meetingId) {
    requireMeeting(meetingId, MeetingStatus.TRANSCRIBED, MeetingStatus.READY);
    Transcript transcript =
        transcriptRepository
            .findByMeetingId(meetingId)
            .orElseThrow(() -> PermanentStageException.transcriptNotFound(meetingId));

    MeetingInsights insights = extractor.analyze(transcript.text()).forMeeting(meetingId);
    insightsRepository.save(insights);

    LOGGER.info(
        "Insights stored: meetingId={}, actionItems={}, topics={}",
        meetingId,
        insights.actionItems().size(),
        insights.topics().size());
  }
}
