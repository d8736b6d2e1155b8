package ca.gc.cra.screenlog.infrastructure.storage;

import ca.gc.cra.screenlog.application.port.DiskSpacePort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports usable space on the file store that holds the recordings directory.
 *
 * <p>The nearest existing ancestor is queried when the directory has not been created yet.</p>
 *
 * @since 0.1.0
 */
public final class LocalDiskSpaceAdapter implements DiskSpacePort {
  private static final Logger log = LoggerFactory.getLogger(LocalDiskSpaceAdapter.class);

  private final Path directory;

  public LocalDiskSpaceAdapter(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
  }

  @Override
  public long availableBytes() throws IOException {
    Path probe = directory;
    while (probe != null && !Files.exists(probe)) {
      probe = probe.getParent();
    }
    if (probe == null) {
      throw new IOException("No existing ancestor for " + directory);
    }
    long usable = Files.getFileStore(probe).getUsableSpace();
    log.debug("Usable space at {}: {} bytes", probe, usable);
    return usable;
  }
}
