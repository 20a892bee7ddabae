package com.scholary.meeting.pipeline.diarization;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration for the optional speaker diarization service. Timeouts in seconds. */
@ConfigurationProperties(prefix = "diarization")
@Validated
public record DiarizationProperties(
    boolean enabled, String baseUrl, @Positive int connectTimeout, @Positive int readTimeout) {}
