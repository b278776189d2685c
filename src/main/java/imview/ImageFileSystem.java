package imview;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import imview.tasks.TaskFactory;
import imview.tasks.ThreadBasedTaskFactory;
import imview.watch.DirectoryWatcher;
import imview.watch.DirectoryWatcherFactory;

/**
 * Finds the images to show, keeps an eye on their directory, and decodes them in the background.
 *
 * Everything the caller needs to know arrives on {@link #events()}: first one
 * {@link FileEvent.Kind#ADDED} per image found at startup, then live changes from the
 * watched directory and the results of {@link #readFile} and {@link #readThumbnail}, in
 * the order the {@link EventFunnel} saw them. The notify hook runs once per forwarded
 * event, e.g. to wake up a UI loop that then drains the stream.
 *
 * A directory is only watched if the startup paths resolve to exactly one directory.
 */
public class ImageFileSystem {

  private static final Logger log = LoggerFactory.getLogger(ImageFileSystem.class);
  private final Channel<OutputEvent> output;
  private final WorkerPools workerPools;
  private final ShutdownFlag shutdownFlag;
  private final Optional<DirectoryWatcher> watcher;

  private ImageFileSystem(Channel<OutputEvent> output, WorkerPools workerPools, ShutdownFlag shutdownFlag, Optional<DirectoryWatcher> watcher) {
    this.output = output;
    this.workerPools = workerPools;
    this.shutdownFlag = shutdownFlag;
    this.watcher = watcher;
  }

  public static ImageFileSystem start(Collection<Path> initialPaths, Runnable notifyHook) throws IOException {
    return start(initialPaths, notifyHook, Options.defaults());
  }

  /**
   * Resolves {@code initialPaths}, starts the watch (if any), the worker pools and the event funnel.
   *
   * @throws IOException if a path can't be resolved or the watch can't be set up
   */
  public static ImageFileSystem start(Collection<Path> initialPaths, Runnable notifyHook, Options options) throws IOException {
    ResolvedPaths resolved = new PathResolver(options.imageFormats).resolve(initialPaths);
    log.debug("Resolved {}", resolved);

    ShutdownFlag shutdownFlag = new ShutdownFlag();
    Channel<FunnelInput> inbox = new Channel<>("funnel-inbox");
    Channel<OutputEvent> output = new Channel<>("events");

    Optional<DirectoryWatcher> watcher = Optional.empty();
    if (resolved.getRoot().isPresent()) {
      Path root = resolved.getRoot().get();
      log.trace("Start watching directory: {}", root);
      watcher = Optional.of(options.getWatcherFactory().newWatcher(root, options.debounceWindow));
      options.taskFactory.runTask(new WatchBridge(watcher.get(), inbox, shutdownFlag));
    }

    WorkerPools pools = new WorkerPools(options.thumbnailThreads, options.imageThreads, options.codec, inbox, shutdownFlag);
    options.taskFactory.runTask(new EventFunnel(inbox, output, options.imageFormats, notifyHook, shutdownFlag, watcher));

    // the initial snapshot goes out in the same shape as live updates
    for (Path file : resolved.getFiles()) {
      try {
        output.send(OutputEvent.of(FileEvent.added(file)));
      } catch (ChannelClosedException e) {
        throw new IllegalStateException("Event stream closed before it was handed out", e);
      }
    }
    return new ImageFileSystem(output, pools, shutdownFlag, watcher);
  }

  /** Decodes {@code path} in the background; the result arrives as {@link OperationResult.Kind#IMAGE_LOADED}. */
  public void readFile(Path path) {
    workerPools.submitImage(path);
  }

  /** Decodes and shrinks {@code path} to fit {@code size x size}; arrives as {@link OperationResult.Kind#THUMBNAIL_LOADED}. */
  public void readThumbnail(Path path, int size) {
    workerPools.submitThumbnail(path, size);
  }

  /**
   * Marks the service as shutting down.
   *
   * Nothing is stopped or joined here; the background threads end on their own as their
   * channels close, and with this set they do so without logging errors.
   */
  public void shutdown() {
    log.trace("Shutting down");
    shutdownFlag.set();
  }

  public EventStream<OutputEvent> events() {
    return output;
  }

  public Optional<Path> getWatchedRoot() {
    return watcher.map(DirectoryWatcher::getRoot);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("root", getWatchedRoot().orElse(null)).add("shutdown", shutdownFlag.isSet()).toString();
  }

  /**
   * Tuning knobs and collaborators for {@link ImageFileSystem#start}; immutable, so each {@code with} returns a copy.
   */
  public static final class Options {

    private static final Duration defaultDebounceWindow = Duration.ofSeconds(10);
    private final int thumbnailThreads;
    private final int imageThreads;
    private final Duration debounceWindow;
    private final Predicate<Path> imageFormats;
    private final ImageCodec codec;
    private final TaskFactory taskFactory;
    // null means the default WatchService-based factory
    private final DirectoryWatcherFactory watcherFactory;

    private Options(
      int thumbnailThreads,
      int imageThreads,
      Duration debounceWindow,
      Predicate<Path> imageFormats,
      ImageCodec codec,
      TaskFactory taskFactory,
      DirectoryWatcherFactory watcherFactory) {
      Preconditions.checkArgument(thumbnailThreads > 0, "thumbnailThreads must be positive: %s", thumbnailThreads);
      Preconditions.checkArgument(imageThreads > 0, "imageThreads must be positive: %s", imageThreads);
      Preconditions.checkArgument(!debounceWindow.isNegative(), "debounceWindow must not be negative: %s", debounceWindow);
      this.thumbnailThreads = thumbnailThreads;
      this.imageThreads = imageThreads;
      this.debounceWindow = debounceWindow;
      this.imageFormats = Preconditions.checkNotNull(imageFormats);
      this.codec = Preconditions.checkNotNull(codec);
      this.taskFactory = Preconditions.checkNotNull(taskFactory);
      this.watcherFactory = watcherFactory;
    }

    public static Options defaults() {
      int poolSize = WorkerPools.defaultPoolSize();
      return new Options(poolSize, poolSize, defaultDebounceWindow, ImageFormats::isImage, new ImageIoCodec(), new ThreadBasedTaskFactory(), null);
    }

    public Options withThumbnailThreads(int thumbnailThreads) {
      return new Options(thumbnailThreads, imageThreads, debounceWindow, imageFormats, codec, taskFactory, watcherFactory);
    }

    public Options withImageThreads(int imageThreads) {
      return new Options(thumbnailThreads, imageThreads, debounceWindow, imageFormats, codec, taskFactory, watcherFactory);
    }

    public Options withDebounceWindow(Duration debounceWindow) {
      return new Options(thumbnailThreads, imageThreads, debounceWindow, imageFormats, codec, taskFactory, watcherFactory);
    }

    public Options withImageFormats(Predicate<Path> imageFormats) {
      return new Options(thumbnailThreads, imageThreads, debounceWindow, imageFormats, codec, taskFactory, watcherFactory);
    }

    public Options withCodec(ImageCodec codec) {
      return new Options(thumbnailThreads, imageThreads, debounceWindow, imageFormats, codec, taskFactory, watcherFactory);
    }

    public Options withTaskFactory(TaskFactory taskFactory) {
      return new Options(thumbnailThreads, imageThreads, debounceWindow, imageFormats, codec, taskFactory, watcherFactory);
    }

    public Options withWatcherFactory(DirectoryWatcherFactory watcherFactory) {
      return new Options(thumbnailThreads, imageThreads, debounceWindow, imageFormats, codec, taskFactory, watcherFactory);
    }

    public int getThumbnailThreads() {
      return thumbnailThreads;
    }

    public int getImageThreads() {
      return imageThreads;
    }

    public Duration getDebounceWindow() {
      return debounceWindow;
    }

    DirectoryWatcherFactory getWatcherFactory() {
      return watcherFactory != null ? watcherFactory : DirectoryWatcherFactory.newFactory(taskFactory);
    }

    @Override
    public String toString() {
      return MoreObjects
        .toStringHelper(this)
        .add("thumbnailThreads", thumbnailThreads)
        .add("imageThreads", imageThreads)
        .add("debounceWindow", debounceWindow)
        .toString();
    }
  }

}
