package imview;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import imview.tasks.TaskLogic;
import imview.watch.DirectoryWatcher;

/**
 * Moves raw events from a {@link DirectoryWatcher} into the {@link EventFunnel}'s inbox, unchanged.
 *
 * Runs until either the watcher's channel or the inbox closes; on the way out it closes
 * the watcher, so nothing keeps watching for a funnel that's gone, and tells the funnel
 * that the watch source is gone.
 */
public class WatchBridge implements TaskLogic {

  private static final Logger log = LoggerFactory.getLogger(WatchBridge.class);
  private static final Duration STOP = Duration.ofMillis(-1);
  private final DirectoryWatcher watcher;
  private final Channel<FunnelInput> inbox;
  private final ShutdownFlag shutdownFlag;

  WatchBridge(DirectoryWatcher watcher, Channel<FunnelInput> inbox, ShutdownFlag shutdownFlag) {
    this.watcher = watcher;
    this.inbox = inbox;
    this.shutdownFlag = shutdownFlag;
  }

  @Override
  public Duration runOneLoop() throws InterruptedException {
    RawEvent event;
    try {
      event = watcher.events().take();
    } catch (ChannelClosedException e) {
      if (inbox.isClosed()) {
        // the funnel stopped first and closed the watcher on its way out
        log.debug("Directory watcher closed by the event funnel");
      } else {
        Utils.logUnlessShuttingDown(log, shutdownFlag, "Directory watcher ended", e);
      }
      return STOP;
    }
    try {
      inbox.send(FunnelInput.watch(event));
    } catch (ChannelClosedException e) {
      Utils.logUnlessShuttingDown(log, shutdownFlag, "Failed to send watch event to the event funnel", e);
      return STOP;
    }
    return null;
  }

  @Override
  public void onStop() {
    watcher.close();
    try {
      inbox.send(FunnelInput.watchClosed());
    } catch (ChannelClosedException e) {
      log.debug("Event funnel already gone");
    }
  }

}
