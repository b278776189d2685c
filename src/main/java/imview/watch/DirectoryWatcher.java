package imview.watch;

import java.io.Closeable;
import java.nio.file.Path;

import imview.EventStream;
import imview.RawEvent;

/**
 * A debounced, non-recursive watch on a single directory.
 *
 * Changes to entries directly inside {@link #getRoot()} are published on {@link #events()}
 * once they have settled. The stream is closed when the watch ends, either because
 * {@link #close()} was called or because the directory went away.
 */
public interface DirectoryWatcher extends Closeable {

  Path getRoot();

  EventStream<RawEvent> events();

  @Override
  void close();

}
