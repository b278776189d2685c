package imview;

/**
 * Thrown when sending to, or receiving from, a {@link Channel} whose counterpart has gone away.
 *
 * This is the expected way for the service's threads to wind down.
 */
public class ChannelClosedException extends Exception {

  private static final long serialVersionUID = 1L;

  public ChannelClosedException(String channelName) {
    super("Channel " + channelName + " is closed");
  }

}
