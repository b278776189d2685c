package imview;

import java.nio.file.Path;

/**
 * A failure to open, decode or resize one image.
 *
 * These never cross a thread boundary as thrown exceptions; they travel inside a {@link DecodeResult}.
 */
public class DecodeException extends Exception {

  private static final long serialVersionUID = 1L;
  private final Path path;

  public DecodeException(Path path, String message) {
    super(message + ": " + path);
    this.path = path;
  }

  public DecodeException(Path path, String message, Throwable cause) {
    super(message + ": " + path, cause);
    this.path = path;
  }

  public Path getPath() {
    return path;
  }

}
