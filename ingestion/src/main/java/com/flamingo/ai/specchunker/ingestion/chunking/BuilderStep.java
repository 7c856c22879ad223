package com.flamingo.ai.specchunker.ingestion.chunking;

import com.flamingo.ai.specchunker.ingestion.model.Chunk;
import java.util.List;

/**
 * Result of feeding one unit to a chunk builder: the builder's next state and the chunks flushed
 * on the way.
 *
 * @param state state to pass with the next unit
 * @param emitted chunks completed by this step, in emission order
 * @param <S> builder state type
 */
public record BuilderStep<S>(S state, List<Chunk> emitted) {

  public BuilderStep {
    emitted = List.copyOf(emitted);
  }

  public static <S> BuilderStep<S> of(S state) {
    return new BuilderStep<>(state, List.of());
  }
}
