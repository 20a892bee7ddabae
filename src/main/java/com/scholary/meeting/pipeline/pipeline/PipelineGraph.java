package com.scholary.meeting.pipeline.pipeline;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The stage chain as an explicit ordered list.
 *
 * <p>Each stage enqueues exactly the stage that follows it here, and the last stage enqueues
 * nothing.
 */
public final class PipelineGraph {

  private final List<PipelineStage> stages;

  public PipelineGraph(List<PipelineStage> stages) {
    if (stages == null || stages.isEmpty()) {
      throw new IllegalArgumentException("Pipeline must have at least one stage");
    }
    Set<PipelineStage> seen = EnumSet.noneOf(PipelineStage.class);
    for (PipelineStage stage : stages) {
      if (!seen.add(stage)) {
        throw new IllegalArgumentException("Stage appears twice in pipeline: " + stage);
      }
    }
    this.stages = List.copyOf(stages);
  }

  /** Transcribe, then insights, then embeddings. */
  public static PipelineGraph standard() {
    return new PipelineGraph(
        List.of(PipelineStage.TRANSCRIBE, PipelineStage.INSIGHTS, PipelineStage.EMBEDDINGS));
  }

  public PipelineStage first() {
    return stages.get(0);
  }

  public Optional<PipelineStage> next(PipelineStage stage) {
    int index = stages.indexOf(stage);
    if (index < 0) {
      throw new IllegalArgumentException("Stage is not part of this pipeline: " + stage);
    }
    return index + 1 < stages.size() ? Optional.of(stages.get(index + 1)) : Optional.empty();
  }

  public boolean isLast(PipelineStage stage) {
    return next(stage).isEmpty();
  }

  public List<PipelineStage> stages() {
    return stages;
  }

  @Override
  public String toString() {
    return "PipelineGraph" + stages;
  }
}
