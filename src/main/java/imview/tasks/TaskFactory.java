package imview.tasks;

/**
 * An abstraction for running tasks on dedicated threads, e.g. the watch bridge or the event funnel.
 *
 * Each task gets its own thread, so it can block on a channel without tying up a pool,
 * and talks to the other tasks only through {@link imview.Channel}s.
 *
 * There is deliberately no way to stop a task from the outside: tasks end when their loop
 * says so, typically because one of their channels was closed.
 */
public interface TaskFactory {

  void runTask(TaskLogic logic);

}
