package com.scholary.meeting.pipeline.api;

import com.scholary.meeting.pipeline.meeting.MeetingStatus;

/** Where a meeting is in the pipeline and which outputs exist so far. */
public record MeetingStatusResponse(
    String meetingId,
    String title,
    MeetingStatus status,
    Double durationSeconds,
    boolean transcriptAvailable,
    boolean insightsAvailable,
    int chunkCount,
    String kibanaUrl) {}
