package imview.tasks;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs each task on a dedicated daemon thread.
 */
public class ThreadBasedTaskFactory implements TaskFactory {

  private final Set<TaskLogic> running = ConcurrentHashMap.newKeySet();

  @Override
  public void runTask(TaskLogic logic) {
    ThreadBasedTask task = new ThreadBasedTask(logic, () -> running.remove(logic));
    running.add(logic);
    task.start();
  }

  /** @return whether {@code logic} was started here and its loop has not finished yet */
  public boolean isRunning(TaskLogic logic) {
    return running.contains(logic);
  }

}
