package imview;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import com.google.common.base.Preconditions;

/**
 * The default {@link ImageCodec}, backed by {@code javax.imageio} and Java2D.
 */
public class ImageIoCodec implements ImageCodec {

  @Override
  public BufferedImage decode(Path path) throws DecodeException {
    BufferedImage read;
    try (InputStream in = Files.newInputStream(path)) {
      read = ImageIO.read(in);
    } catch (NoSuchFileException e) {
      throw new DecodeException(path, "File not found", e);
    } catch (IOException | RuntimeException e) {
      // ImageIO plugins throw all sorts of runtime exceptions on corrupt input
      throw new DecodeException(path, "Failed to decode image", e);
    }
    if (read == null) {
      throw new DecodeException(path, "Unsupported image format");
    }
    return toArgb(read);
  }

  @Override
  public BufferedImage resizeToFit(BufferedImage image, int size) {
    Preconditions.checkArgument(size > 0, "size must be positive: %s", size);
    int[] dimensions = ImageCodec.fitWithin(image.getWidth(), image.getHeight(), size);
    BufferedImage resized = new BufferedImage(dimensions[0], dimensions[1], BufferedImage.TYPE_INT_ARGB);
    Graphics2D g = resized.createGraphics();
    try {
      g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
      g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
      g.drawImage(image, 0, 0, dimensions[0], dimensions[1], null);
    } finally {
      g.dispose();
    }
    return resized;
  }

  private static BufferedImage toArgb(BufferedImage image) {
    if (image.getType() == BufferedImage.TYPE_INT_ARGB) {
      return image;
    }
    BufferedImage argb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_ARGB);
    Graphics2D g = argb.createGraphics();
    try {
      g.drawImage(image, 0, 0, null);
    } finally {
      g.dispose();
    }
    return argb;
  }

}
