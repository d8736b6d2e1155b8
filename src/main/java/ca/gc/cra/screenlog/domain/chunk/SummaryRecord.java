package ca.gc.cra.screenlog.domain.chunk;

import java.util.Objects;
import java.util.Optional;

/**
 * Downstream timeline entry produced from an analysis batch. It may point at a chunk file; retention cleanup
 * clears the pointer but keeps the record.
 *
 * @param id store-assigned identifier
 * @param batchId batch the summary was produced from
 * @param startEpochSeconds covered range start
 * @param endEpochSeconds covered range end
 * @param title summary title
 * @param videoFile chunk file the summary refers to, if any
 * @since 0.1.0
 */
public record SummaryRecord(
    long id,
    long batchId,
    long startEpochSeconds,
    long endEpochSeconds,
    String title,
    Optional<String> videoFile) {

  public SummaryRecord {
    Objects.requireNonNull(title, "title");
    videoFile = Objects.requireNonNullElse(videoFile, Optional.empty());
  }
}
