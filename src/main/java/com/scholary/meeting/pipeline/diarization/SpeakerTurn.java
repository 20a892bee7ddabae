package com.scholary.meeting.pipeline.diarization;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** A stretch of audio attributed to one speaker. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpeakerTurn(String speaker, double start, double end) {}
