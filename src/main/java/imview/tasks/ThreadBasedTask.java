package imview.tasks;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import imview.Utils;

/**
 * Provides the basic "start up a thread and loop until told otherwise" abstraction.
 *
 * Kind of actor-like. Ish.
 */
class ThreadBasedTask {

  private static final Logger log = LoggerFactory.getLogger(ThreadBasedTask.class);
  private static final AtomicInteger nextThread = new AtomicInteger();
  private final CountDownLatch isStarted = new CountDownLatch(1);
  private final Thread thread;
  private final TaskLogic task;
  private final Runnable onFinished;

  ThreadBasedTask(TaskLogic task, Runnable onFinished) {
    this.task = task;
    this.onFinished = onFinished;
    thread = new ThreadFactoryBuilder() //
      .setDaemon(true)
      .setNameFormat(nextThread.getAndIncrement() + "-" + task.getName() + "-%s")
      .build()
      .newThread(() -> run());
  }

  void start() {
    thread.start();
    Utils.resetIfInterrupted(() -> isStarted.await());
  }

  private void run() {
    try {
      isStarted.countDown();
      try {
        task.onStart();
        while (!Thread.currentThread().isInterrupted()) {
          Duration wait = task.runOneLoop();
          if (wait != null) {
            if (wait.isNegative()) {
              break;
            }
            Thread.sleep(wait.toMillis());
          }
        }
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
      } catch (Exception e) {
        log.error("Error returned from runOneLoop of " + task.getName(), e);
      }
      callTaskStop();
    } finally {
      try {
        onFinished.run();
      } catch (Exception e) {
        log.error("onFinished call failed", e);
      }
    }
  }

  private void callTaskStop() {
    try {
      task.onStop();
    } catch (Exception e) {
      log.error("task.onStop() call failed", e);
    }
  }

}
