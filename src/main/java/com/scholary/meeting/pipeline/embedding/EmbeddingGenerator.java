package com.scholary.meeting.pipeline.embedding;

import java.util.List;

/** Turns texts into fixed-dimension vectors. */
public interface EmbeddingGenerator {

  /**
   * Embed texts.
   *
   * @return one vector per input, in input order, each of {@link #dimension()} floats
   * @throws EmbeddingException if the backend fails or answers with the wrong shape
   */
  List<float[]> embed(List<String> texts);

  int dimension();
}
