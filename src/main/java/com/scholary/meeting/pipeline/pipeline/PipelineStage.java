package com.scholary.meeting.pipeline.pipeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** The units of work in the meeting processing chain. */
public enum PipelineStage {
  TRANSCRIBE("transcribe"),
  INSIGHTS("insights"),
  EMBEDDINGS("embeddings");

  private final String stageName;

  PipelineStage(String stageName) {
    this.stageName = stageName;
  }

  /** Name used on the wire and in idempotency keys. */
  @JsonValue
  public String stageName() {
    return stageName;
  }

  @JsonCreator
  public static PipelineStage fromStageName(String name) {
    for (PipelineStage stage : values()) {
      if (stage.stageName.equalsIgnoreCase(name) || stage.name().equalsIgnoreCase(name)) {
        return stage;
      }
    }
    throw new IllegalArgumentException("Unknown pipeline stage: " + name);
  }
}
