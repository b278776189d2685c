package imview.watch;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.time.Duration;

import imview.tasks.TaskFactory;

/**
 * Creates watchers, given we only know the directory to watch once the input paths are resolved.
 */
public interface DirectoryWatcherFactory {

  /** Sets up the watch on {@code root}; failures here are fatal to the caller. */
  DirectoryWatcher newWatcher(Path root, Duration debounceWindow) throws IOException;

  /**
   * @return the default factory, which uses the JDK's {@link java.nio.file.WatchService}
   */
  static DirectoryWatcherFactory newFactory(TaskFactory taskFactory) {
    return (root, debounceWindow) -> WatchServiceDirectoryWatcher.start(taskFactory, FileSystems.getDefault().newWatchService(), root, debounceWindow);
  }

}
