package com.scholary.meeting.pipeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meeting.pipeline.diarization.DiarizationProperties;
import com.scholary.meeting.pipeline.diarization.DisabledSpeakerDiarizer;
import com.scholary.meeting.pipeline.diarization.HttpSpeakerDiarizer;
import com.scholary.meeting.pipeline.diarization.SpeakerDiarizer;
import com.scholary.meeting.pipeline.whisper.WhisperProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for speech recognition and the optional diarization service.
 */
@Configuration
@EnableConfigurationProperties({WhisperProperties.class, DiarizationProperties.class})
public class WhisperConfig {

  @Bean
  public SpeakerDiarizer speakerDiarizer(
      DiarizationProperties properties, ObjectMapper objectMapper) {
    if (!properties.enabled()) {
      return new DisabledSpeakerDiarizer();
    }
    if (properties.baseUrl() == null || properties.baseUrl().isBlank()) {
      throw new IllegalStateException("diarization.base-url is required when diarization is enabled");
    }
    return new HttpSpeakerDiarizer(properties, objectMapper);
  }
}
