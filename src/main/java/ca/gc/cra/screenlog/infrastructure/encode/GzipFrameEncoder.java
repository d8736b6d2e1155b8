package ca.gc.cra.screenlog.infrastructure.encode;

import ca.gc.cra.screenlog.application.port.EncoderPort;
import ca.gc.cra.screenlog.domain.capture.CapturedFrame;
import ca.gc.cra.screenlog.domain.chunk.ChunkFileName;
import ca.gc.cra.screenlog.domain.compression.CompletedChunk;
import ca.gc.cra.screenlog.domain.compression.CompressionSettings;
import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.zip.Deflater;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reference {@link EncoderPort} that writes frames into gzip-compressed {@code .sfr} chunk
 * files.
 * <p><strong>Why:</strong> Exercises chunk rotation, naming and size feedback end to end without a native video
 * codec.</p>
 * <p><strong>Role:</strong> Infrastructure adapter on the encode side.</p>
 * <p><strong>Format:</strong> gzip stream of {@code SFR1} magic, a settings header, then one record per frame
 * ({@code capturedAtMillis, displayId, width, height, keyframe, length, bytes}). Every {@code keyframeInterval}-th
 * frame is stored whole; the rest are XOR deltas against the previous frame. The deflate level follows the effective
 * bitrate so higher multipliers produce larger files.</p>
 * <p><strong>Thread-safety:</strong> Sessions are single-threaded; distinct sessions may run concurrently.</p>
 *
 * @since 0.1.0
 */
public final class GzipFrameEncoder implements EncoderPort {
  private static final Logger log = LoggerFactory.getLogger(GzipFrameEncoder.class);
  public static final String EXTENSION = "sfr";
  private static final byte[] MAGIC = "SFR1".getBytes(StandardCharsets.US_ASCII);

  private final Path directory;

  /**
   * @param directory recordings directory; created on first use
   */
  public GzipFrameEncoder(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  @Override
  public Session begin(CompressionSettings settings, long startEpochSeconds) throws IOException {
    Objects.requireNonNull(settings, "settings");
    Files.createDirectories(directory);
    Path partial = directory.resolve(startEpochSeconds + "_open." + EXTENSION + ".part");
    return new GzipSession(partial, settings, startEpochSeconds);
  }

  @Override
  public Path chunkFile(long startEpochSeconds, long endEpochSeconds) {
    return new ChunkFileName(startEpochSeconds, endEpochSeconds, EXTENSION).resolveIn(directory);
  }

  static int deflateLevel(CompressionSettings settings) {
    double ratio = (double) settings.effectiveBitrate() / Math.max(1L, settings.baseBitrate());
    if (ratio >= 1.5) {
      return 1;
    }
    if (ratio >= 1.0) {
      return 4;
    }
    if (ratio >= 0.7) {
      return 6;
    }
    return Deflater.BEST_COMPRESSION;
  }

  private final class GzipSession implements Session {
    private final Path partial;
    private final CompressionSettings settings;
    private final long startEpochSeconds;
    private final DataOutputStream out;
    private byte[] previous = new byte[0];
    private int frames;
    private boolean closed;

    private GzipSession(Path partial, CompressionSettings settings, long startEpochSeconds) throws IOException {
      this.partial = partial;
      this.settings = settings;
      this.startEpochSeconds = startEpochSeconds;
      int level = deflateLevel(settings);
      GZIPOutputStream gzip = new GZIPOutputStream(Files.newOutputStream(partial), 1 << 16) {
        {
          def.setLevel(level);
        }
      };
      this.out = new DataOutputStream(new BufferedOutputStream(gzip, 1 << 16));
      out.write(MAGIC);
      out.writeInt(settings.resolution().width());
      out.writeInt(settings.resolution().height());
      out.writeUTF(settings.codec().name());
      out.writeLong(settings.effectiveBitrate());
      out.writeInt(settings.keyframeInterval());
      log.debug("Opened chunk {} (deflate level {}, bitrate {})", partial.getFileName(), level,
          settings.effectiveBitrate());
    }

    @Override
    public void append(CapturedFrame frame) throws IOException {
      Objects.requireNonNull(frame, "frame");
      if (closed) {
        throw new IllegalStateException("session already closed");
      }
      byte[] pixels = frame.pixels();
      boolean keyframe = frames % settings.keyframeInterval() == 0;
      byte[] body = keyframe ? pixels : delta(previous, pixels);
      out.writeLong(frame.capturedAtMillis());
      out.writeInt(frame.displayId());
      out.writeInt(frame.width());
      out.writeInt(frame.height());
      out.writeBoolean(keyframe);
      out.writeInt(body.length);
      out.write(body);
      previous = pixels;
      frames++;
    }

    @Override
    public CompletedChunk finish(long endEpochSeconds) throws IOException {
      if (closed) {
        throw new IllegalStateException("session already closed");
      }
      closed = true;
      long end = Math.max(endEpochSeconds, startEpochSeconds);
      out.close();
      Path target = new ChunkFileName(startEpochSeconds, end, EXTENSION).resolveIn(directory);
      Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      long size = Files.size(target);
      log.info("Wrote chunk {} ({} frames, {} bytes)", target.getFileName(), frames, size);
      return new CompletedChunk(target, size, startEpochSeconds, end, frames, settings);
    }

    @Override
    public void abort() {
      if (closed) {
        return;
      }
      closed = true;
      try {
        out.close();
      } catch (IOException ex) {
        log.debug("Ignoring close failure while aborting {}", partial.getFileName(), ex);
      }
      try {
        Files.deleteIfExists(partial);
      } catch (IOException ex) {
        log.warn("Unable to delete aborted chunk {}", partial, ex);
      }
    }

    @Override
    public int frameCount() {
      return frames;
    }
  }

  private static byte[] delta(byte[] previous, byte[] current) {
    if (previous.length != current.length) {
      return current;
    }
    byte[] diff = new byte[current.length];
    for (int i = 0; i < current.length; i++) {
      diff[i] = (byte) (current[i] ^ previous[i]);
    }
    return diff;
  }
}
