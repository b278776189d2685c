package imview.watch;

import java.nio.file.Path;

import imview.Channel;
import imview.ChannelClosedException;
import imview.EventStream;
import imview.RawEvent;

/** A watcher whose events are injected by the test. */
public class StubDirectoryWatcher implements DirectoryWatcher {

  private final Path root;
  private final Channel<RawEvent> events = new Channel<>("stub-watch-events");

  public StubDirectoryWatcher(Path root) {
    this.root = root;
  }

  public void emit(RawEvent event) throws ChannelClosedException {
    events.send(event);
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
    events.close();
  }

}
