package imview;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;

import imview.tasks.TaskLogic;
import imview.watch.DirectoryWatcher;

/**
 * Merges watch events and finished jobs into the single stream the consumer reads.
 *
 * Both the {@link WatchBridge} and the {@link WorkerPools} post into one inbox, so items
 * from the same source keep their order, while items from different sources are
 * interleaved in whatever order they arrived. Each item is classified, forwarded, and
 * followed by exactly one call to the notify hook.
 *
 * The funnel ends when the consumer closes the output stream, or when one of its
 * sources goes away; either way it then closes its inbox, the output stream and the
 * directory watcher, if there is one.
 */
public class EventFunnel implements TaskLogic {

  private static final Logger log = LoggerFactory.getLogger(EventFunnel.class);
  private static final Duration STOP = Duration.ofMillis(-1);
  private final Channel<FunnelInput> inbox;
  private final Channel<OutputEvent> output;
  private final Predicate<Path> isImage;
  private final Runnable notifyHook;
  private final ShutdownFlag shutdownFlag;
  private final Optional<DirectoryWatcher> watcher;

  EventFunnel(Channel<FunnelInput> inbox, Channel<OutputEvent> output, Predicate<Path> isImage, Runnable notifyHook, ShutdownFlag shutdownFlag) {
    this(inbox, output, isImage, notifyHook, shutdownFlag, Optional.empty());
  }

  EventFunnel(
    Channel<FunnelInput> inbox,
    Channel<OutputEvent> output,
    Predicate<Path> isImage,
    Runnable notifyHook,
    ShutdownFlag shutdownFlag,
    Optional<DirectoryWatcher> watcher) {
    this.watcher = watcher;
    this.inbox = inbox;
    this.output = output;
    this.isImage = isImage;
    this.notifyHook = notifyHook;
    this.shutdownFlag = shutdownFlag;
  }

  @Override
  public Duration runOneLoop() throws InterruptedException {
    FunnelInput input;
    try {
      input = inbox.take();
    } catch (ChannelClosedException e) {
      Utils.logUnlessShuttingDown(log, shutdownFlag, "Event funnel input closed", e);
      return STOP;
    }

    OutputEvent event;
    switch (input.getKind()) {
      case WATCH:
        FileEvent fileEvent = classify(input.getRawEvent(), isImage);
        if (fileEvent == null) {
          log.trace("Dropped {}", input.getRawEvent());
          return null;
        }
        event = OutputEvent.of(fileEvent);
        break;
      case OPERATION:
        event = OutputEvent.of(input.getOperationResult());
        break;
      case WATCH_CLOSED:
        Utils.logUnlessShuttingDown(log, shutdownFlag, "Event funnel stopping, directory watch input closed", null);
        return STOP;
      default:
        throw new IllegalStateException("Unhandled input " + input);
    }

    try {
      output.send(event);
    } catch (ChannelClosedException e) {
      log.debug("Consumer closed the event stream, stopping");
      return STOP;
    }
    log.trace("Forwarded {}", event);
    callNotifyHook();
    return null;
  }

  /** Once we're gone, the consumer sees the end of its stream, producers see a closed inbox, and the watch ends. */
  @Override
  public void onStop() {
    output.close();
    inbox.close();
    watcher.ifPresent(DirectoryWatcher::close);
  }

  /** @return the consumer-facing shape of {@code raw}, or {@code null} if it should be dropped */
  @VisibleForTesting
  static FileEvent classify(RawEvent raw, Predicate<Path> isImage) {
    switch (raw.getKind()) {
      case CREATE:
        return isImage.test(raw.getPath()) ? FileEvent.added(raw.getPath()) : null;
      case WRITE:
        return isImage.test(raw.getPath()) ? FileEvent.modified(raw.getPath()) : null;
      case REMOVE:
        // the file may be gone, so we can't tell whether it was an image
        return FileEvent.removed(raw.getPath());
      case RENAME:
        return FileEvent.renamed(raw.getPath(), raw.getNewPath());
      default:
        return null;
    }
  }

  private void callNotifyHook() {
    try {
      notifyHook.run();
    } catch (RuntimeException e) {
      log.error("Notify hook failed", e);
    }
  }

}
