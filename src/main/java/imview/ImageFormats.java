package imview;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

import javax.imageio.ImageIO;

import org.apache.commons.io.FilenameUtils;
import org.jooq.lambda.Seq;

import com.google.common.collect.ImmutableSet;

/**
 * Decides whether a path looks like an image we can decode, based only on its extension.
 */
public final class ImageFormats {

  // ImageIO registers its readers once per JVM (plugins on the classpath included)
  private static final Set<String> readableSuffixes = ImmutableSet.copyOf(Seq.of(ImageIO.getReaderFileSuffixes()).map(s -> s.toLowerCase(Locale.ROOT)));

  private ImageFormats() {
  }

  /** @return true if some ImageIO reader is registered for {@code path}'s extension */
  public static boolean isImage(Path path) {
    Path fileName = path.getFileName();
    if (fileName == null) {
      return false;
    }
    String extension = FilenameUtils.getExtension(fileName.toString()).toLowerCase(Locale.ROOT);
    return !extension.isEmpty() && readableSuffixes.contains(extension);
  }

  public static Set<String> getReadableSuffixes() {
    return readableSuffixes;
  }

}
