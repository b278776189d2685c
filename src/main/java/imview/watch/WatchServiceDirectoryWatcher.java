package imview.watch;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Ticker;

import imview.Channel;
import imview.ChannelClosedException;
import imview.EventStream;
import imview.RawEvent;
import imview.tasks.TaskFactory;
import imview.tasks.TaskLogic;

/**
 * Watches the entries directly inside one directory with the JDK {@link WatchService}.
 *
 * Two tasks cooperate: the {@link Reader} drains the watch service as fast as it can and
 * hands every native event to the {@link Debouncer}, which owns a {@link ChangeCoalescer}
 * and only publishes a path's event once it has been quiet for the debounce window.
 *
 * Closing the watcher closes the watch service; the reader then closes its hand-off
 * channel, and the debouncer publishes whatever is still pending before closing
 * {@link #events()}.
 */
public class WatchServiceDirectoryWatcher implements DirectoryWatcher {

  private static final Logger log = LoggerFactory.getLogger(WatchServiceDirectoryWatcher.class);
  private static final Duration STOP = Duration.ofMillis(-1);
  private final WatchService watchService;
  private final Path root;
  private final Ticker ticker;
  private final ChangeCoalescer coalescer;
  private final Channel<NativeChange> changes = new Channel<>("native-changes");
  private final Channel<RawEvent> events = new Channel<>("watch-events");

  WatchServiceDirectoryWatcher(WatchService watchService, Path root, Duration debounceWindow, Ticker ticker) {
    this.watchService = watchService;
    this.root = root;
    this.ticker = ticker;
    this.coalescer = new ChangeCoalescer(debounceWindow);
  }

  /** Registers {@code root} with {@code watchService} and starts the reader and debouncer tasks. */
  public static WatchServiceDirectoryWatcher start(TaskFactory taskFactory, WatchService watchService, Path root, Duration debounceWindow)
    throws IOException {
    WatchServiceDirectoryWatcher w = new WatchServiceDirectoryWatcher(watchService, root, debounceWindow, Ticker.systemTicker());
    try {
      root.register(watchService, ENTRY_CREATE, ENTRY_DELETE, ENTRY_MODIFY);
      w.rememberExistingEntries();
    } catch (IOException | RuntimeException e) {
      watchService.close();
      throw e;
    }
    log.debug("Watching {}, debounce window {}", root, debounceWindow);
    taskFactory.runTask(w.new Reader());
    taskFactory.runTask(w.new Debouncer());
    return w;
  }

  @Override
  public Path getRoot() {
    return root;
  }

  @Override
  public EventStream<RawEvent> events() {
    return events;
  }

  @Override
  public void close() {
    try {
      watchService.close();
    } catch (IOException e) {
      log.warn("Exception when shutting down the watch service", e);
    }
  }

  /** So that deleting and re-creating a pre-existing file within one window is seen as a rename. */
  private void rememberExistingEntries() throws IOException {
    try (Stream<Path> entries = Files.list(root)) {
      for (Path entry : (Iterable<Path>) entries::iterator) {
        coalescer.remember(entry, readFileKey(entry));
      }
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }

  private static Object readFileKey(Path path) {
    try {
      return Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS).fileKey();
    } catch (IOException e) {
      // already gone, or not readable; we just won't be able to pair it up as a rename
      return null;
    }
  }

  /** Moves native events off the watch service and onto the debouncer's channel. */
  private class Reader implements TaskLogic {
    @Override
    public Duration runOneLoop() throws InterruptedException {
      WatchKey watchKey;
      try {
        watchKey = watchService.take();
      } catch (ClosedWatchServiceException e) {
        log.debug("Watch service for {} closed", root);
        return STOP;
      }
      try {
        for (WatchEvent<?> watchEvent : watchKey.pollEvents()) {
          changes.send(toNativeChange(watchEvent));
        }
      } catch (ChannelClosedException e) {
        return STOP;
      }
      if (!watchKey.reset()) {
        log.info("{} is no longer watchable", root);
        return STOP;
      }
      return null;
    }

    @Override
    public void onStop() {
      changes.close();
    }

    private NativeChange toNativeChange(WatchEvent<?> watchEvent) {
      WatchEvent.Kind<?> kind = watchEvent.kind();
      if (log.isTraceEnabled()) {
        log.trace("WatchEvent {} {}", kind, watchEvent.context());
      }
      if (kind == OVERFLOW) {
        return NativeChange.overflow(root);
      }
      Path child = root.resolve((Path) watchEvent.context());
      if (kind == ENTRY_CREATE) {
        return NativeChange.created(child, readFileKey(child));
      } else if (kind == ENTRY_MODIFY) {
        return NativeChange.modified(child);
      } else {
        return NativeChange.deleted(child);
      }
    }
  }

  /** Collects native changes until each path settles, then publishes it. */
  private class Debouncer implements TaskLogic {
    @Override
    public Duration runOneLoop() throws InterruptedException {
      Duration wait = coalescer.timeUntilNextFlush(ticker.read());
      NativeChange change;
      if (wait == null) {
        try {
          change = changes.take();
        } catch (ChannelClosedException e) {
          return finish();
        }
      } else {
        change = changes.poll(wait.toNanos(), TimeUnit.NANOSECONDS);
        if (change == null && changes.isClosed()) {
          return finish();
        }
      }
      if (change != null) {
        coalescer.add(change, ticker.read());
      }
      return publish(coalescer.flush(ticker.read())) ? null : STOP;
    }

    private Duration finish() {
      NativeChange change;
      while ((change = changes.poll()) != null) {
        coalescer.add(change, ticker.read());
      }
      publish(coalescer.flushAll());
      events.close();
      return STOP;
    }

    private boolean publish(List<RawEvent> settled) {
      try {
        for (RawEvent e : settled) {
          log.trace("Settled {}", e);
          events.send(e);
        }
        return true;
      } catch (ChannelClosedException e) {
        // nobody is listening anymore, so stop watching too
        close();
        return false;
      }
    }
  }

}
