package com.scholary.meeting.pipeline.meeting;

/**
 * A span of transcript text with its embedding vector.
 *
 * <p>Start and end times are present only when the chunk was built from time-aligned segments.
 */
public record TranscriptChunk(
    String meetingId,
    int index,
    String text,
    Double startTime,
    Double endTime,
    float[] embedding) {}
