package imview;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Two fixed-size pools of decode workers, one for thumbnails and one for full images, so
 * neither kind of job can starve the other.
 *
 * Jobs are fire-and-forget: each one posts exactly one {@link OperationResult} to the
 * funnel, carrying either the pixels or the reason there are none. Nothing is deduplicated,
 * submitting the same path twice decodes it twice.
 */
public class WorkerPools {

  private static final Logger log = LoggerFactory.getLogger(WorkerPools.class);
  private final ExecutorService thumbnailPool;
  private final ExecutorService imagePool;
  private final ImageCodec codec;
  private final Channel<FunnelInput> inbox;
  private final ShutdownFlag shutdownFlag;

  WorkerPools(int thumbnailThreads, int imageThreads, ImageCodec codec, Channel<FunnelInput> inbox, ShutdownFlag shutdownFlag) {
    this.thumbnailPool = newPool("thumbnail", thumbnailThreads);
    this.imagePool = newPool("image", imageThreads);
    this.codec = codec;
    this.inbox = inbox;
    this.shutdownFlag = shutdownFlag;
  }

  /** @return {@code min(available processors, 4)} */
  public static int defaultPoolSize() {
    return Math.min(Runtime.getRuntime().availableProcessors(), 4);
  }

  public void submitImage(Path path) {
    imagePool.execute(() -> post(OperationResult.imageLoaded(path, loadImage(path))));
  }

  public void submitThumbnail(Path path, int size) {
    Preconditions.checkArgument(size > 0, "thumbnail size must be positive: %s", size);
    thumbnailPool.execute(() -> post(OperationResult.thumbnailLoaded(path, loadThumbnail(path, size))));
  }

  @VisibleForTesting
  DecodeResult loadImage(Path path) {
    try {
      return DecodeResult.success(codec.decode(path));
    } catch (DecodeException e) {
      return DecodeResult.failure(e);
    } catch (RuntimeException e) {
      return DecodeResult.failure(new DecodeException(path, "Unexpected failure while decoding", e));
    }
  }

  @VisibleForTesting
  DecodeResult loadThumbnail(Path path, int size) {
    try {
      BufferedImage image = codec.decode(path);
      return DecodeResult.success(codec.resizeToFit(image, size));
    } catch (DecodeException e) {
      return DecodeResult.failure(e);
    } catch (RuntimeException e) {
      return DecodeResult.failure(new DecodeException(path, "Unexpected failure while creating thumbnail", e));
    }
  }

  private void post(OperationResult result) {
    if (!result.getResult().isSuccess()) {
      log.debug("Decode failed: {}", result.getResult().getError().getMessage());
    }
    try {
      inbox.send(FunnelInput.operation(result));
    } catch (ChannelClosedException e) {
      Utils.logUnlessShuttingDown(log, shutdownFlag, "Can't send " + result.getKind() + " of " + result.getPath() + " to the event funnel", e);
    }
  }

  private static ExecutorService newPool(String name, int threads) {
    Preconditions.checkArgument(threads > 0, "%s pool needs at least one thread", name);
    return Executors.newFixedThreadPool(threads, new ThreadFactoryBuilder() //
      .setDaemon(true)
      .setNameFormat(name + "-worker-%s")
      .build());
  }

}
