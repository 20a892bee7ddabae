package com.scholary.meeting.pipeline.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** A single segment as returned by the Whisper service. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperSegment(double start, double end, String text) {}
