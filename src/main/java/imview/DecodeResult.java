package imview;

import java.awt.image.BufferedImage;
import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * Either a decoded pixel buffer or the {@link DecodeException} explaining why there isn't one.
 */
public final class DecodeResult {

  private final BufferedImage image;
  private final DecodeException error;

  private DecodeResult(BufferedImage image, DecodeException error) {
    this.image = image;
    this.error = error;
  }

  public static DecodeResult success(BufferedImage image) {
    return new DecodeResult(Objects.requireNonNull(image), null);
  }

  public static DecodeResult failure(DecodeException error) {
    return new DecodeResult(null, Objects.requireNonNull(error));
  }

  public boolean isSuccess() {
    return image != null;
  }

  /** @return the pixels, or throws {@link IllegalStateException} for a failed result */
  public BufferedImage getImage() {
    if (image == null) {
      throw new IllegalStateException("No image, decode failed", error);
    }
    return image;
  }

  /** @return the failure, or {@code null} for a successful result */
  public DecodeException getError() {
    return error;
  }

  @Override
  public String toString() {
    if (image != null) {
      return MoreObjects.toStringHelper(this).add("width", image.getWidth()).add("height", image.getHeight()).toString();
    }
    return MoreObjects.toStringHelper(this).add("error", error.getMessage()).toString();
  }

}
