package ca.gc.cra.screenlog.domain.chunk;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A group of chunks handed to the analysis consumer, created atomically with its associations.
 *
 * @param id store-assigned identifier
 * @param startEpochSeconds batch start
 * @param endEpochSeconds batch end
 * @param status processing status
 * @param chunkIds associated chunk ids
 * @param reason optional failure or status reason
 * @since 0.1.0
 */
public record AnalysisBatch(
    long id,
    long startEpochSeconds,
    long endEpochSeconds,
    BatchStatus status,
    Set<Long> chunkIds,
    Optional<String> reason) {

  public AnalysisBatch {
    Objects.requireNonNull(status, "status");
    chunkIds = chunkIds == null ? Set.of() : Set.copyOf(chunkIds);
    reason = Objects.requireNonNullElse(reason, Optional.empty());
  }
}
