package imview;

import org.slf4j.Logger;

public class Utils {

  @FunctionalInterface
  public interface InterruptedRunnable {
    void run() throws InterruptedException;
  }

  public static void resetIfInterrupted(InterruptedRunnable r) {
    try {
      r.run();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException(e);
    }
  }

  /**
   * Logs {@code message} as an error, unless we're shutting down, in which case a closed channel is expected.
   */
  public static void logUnlessShuttingDown(Logger log, ShutdownFlag shutdownFlag, String message, Throwable t) {
    if (shutdownFlag.isSet()) {
      log.debug(message, t);
    } else {
      log.error(message, t);
    }
  }

}
