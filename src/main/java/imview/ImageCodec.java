package imview;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * Decodes and resizes images; the worker pools only ever go through this interface.
 */
public interface ImageCodec {

  /** Reads and decodes {@code path} into an ARGB buffer. */
  BufferedImage decode(Path path) throws DecodeException;

  /**
   * Scales {@code image} so that it fits in a {@code size x size} box, keeping its aspect ratio.
   *
   * Dimensions are floored, see {@link #fitWithin(int, int, int)}.
   */
  BufferedImage resizeToFit(BufferedImage image, int size);

  /**
   * @return the {@code [width, height]} of a {@code width x height} image scaled so that
   *   its longer side is exactly {@code size}; the shorter side is floored and kept at least 1
   */
  static int[] fitWithin(int width, int height, int size) {
    // integer math, as floating point scales can land just below the target
    if (width >= height) {
      return new int[] { size, Math.max((int) ((long) height * size / width), 1) };
    } else {
      return new int[] { Math.max((int) ((long) width * size / height), 1), size };
    }
  }

}
