package imview;

import java.util.Collection;

/**
 * The read side of a {@link Channel}, as handed out to consumers.
 */
public interface EventStream<T> {

  /** Blocks until an item is available; throws once the stream is closed and fully drained. */
  T take() throws InterruptedException, ChannelClosedException;

  /** @return the next item, or {@code null} if none is ready right now */
  T poll();

  /** Moves every ready item into {@code sink} without blocking, and returns how many were moved. */
  default int drainTo(Collection<? super T> sink) {
    int count = 0;
    T item;
    while ((item = poll()) != null) {
      sink.add(item);
      count++;
    }
    return count;
  }

  /** Signals that the consumer is gone; producers will see {@link ChannelClosedException} on their next send. */
  void close();

  boolean isClosed();

}
