package imview;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A cancellation token shared by every thread the service spawns.
 *
 * It only changes how loudly threads complain when their channels close; channel
 * closure alone decides when a thread actually ends.
 */
public final class ShutdownFlag {

  private final AtomicBoolean set = new AtomicBoolean(false);

  public void set() {
    set.set(true);
  }

  public boolean isSet() {
    return set.get();
  }

  @Override
  public String toString() {
    return "ShutdownFlag[" + set.get() + "]";
  }

}
