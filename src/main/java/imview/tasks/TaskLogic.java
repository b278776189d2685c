package imview.tasks;

import java.time.Duration;

import org.apache.commons.lang3.StringUtils;

/**
 * A long-running loop to be executed on a dedicated thread.
 */
public interface TaskLogic {

  /**
   * Run one iteration, and return how long the task wants to sleep.
   *
   * A {@code null} duration loops again immediately, a negative duration ends the task.
   */
  Duration runOneLoop() throws InterruptedException;

  /** Called on the task thread, before we start calling {@link #runOneLoop()} in a loop. */
  default void onStart() throws InterruptedException {
  }

  /** Called on the task thread, after the loop has finished for any reason. */
  default void onStop() {
  }

  default String getName() {
    String name = getClass().getSimpleName();
    // lambdas don't have simple names
    if (name.equals("")) {
      name = StringUtils.substringAfterLast(getClass().getName(), ".");
    }
    return name;
  }
}
