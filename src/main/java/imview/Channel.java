package imview;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An unbounded, many-producer channel that can be closed from either side.
 *
 * Items sent before {@link #close()} are still delivered; after that, senders get a
 * {@link ChannelClosedException} and receivers get one once the backlog is drained.
 */
public class Channel<T> implements EventStream<T> {

  private static final Object CLOSED = new Object();
  private final String name;
  private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public Channel(String name) {
    this.name = name;
  }

  /**
   * Queues {@code item}, or throws if the channel is closed.
   *
   * Holds the same lock as {@link #close()}, so an item that is accepted always lands
   * before the close marker and is delivered.
   */
  public void send(T item) throws ChannelClosedException {
    if (item == null) {
      throw new NullPointerException("item");
    }
    synchronized (closed) {
      if (closed.get()) {
        throw new ChannelClosedException(name);
      }
      queue.add(item);
    }
  }

  @Override
  @SuppressWarnings("unchecked")
  public T take() throws InterruptedException, ChannelClosedException {
    Object o = queue.take();
    if (o == CLOSED) {
      // leave the marker for any other receiver
      queue.add(CLOSED);
      throw new ChannelClosedException(name);
    }
    return (T) o;
  }

  @Override
  @SuppressWarnings("unchecked")
  public T poll() {
    Object o = queue.poll();
    if (o == CLOSED) {
      queue.add(CLOSED);
      return null;
    }
    return (T) o;
  }

  /**
   * Waits up to {@code timeout} for an item.
   *
   * @return the item, or {@code null} on timeout or once the channel is closed and drained
   */
  @SuppressWarnings("unchecked")
  public T poll(long timeout, TimeUnit unit) throws InterruptedException {
    Object o = queue.poll(timeout, unit);
    if (o == CLOSED) {
      queue.add(CLOSED);
      return null;
    }
    return (T) o;
  }

  @Override
  public void close() {
    synchronized (closed) {
      if (closed.compareAndSet(false, true)) {
        queue.add(CLOSED);
      }
    }
  }

  @Override
  public boolean isClosed() {
    return closed.get();
  }

  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return "Channel[" + name + "]";
  }

}
