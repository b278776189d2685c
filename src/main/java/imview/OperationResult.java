package imview;

import java.nio.file.Path;
import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * The completion of a decode job, successful or not.
 */
public final class OperationResult {

  public enum Kind {
    THUMBNAIL_LOADED, IMAGE_LOADED
  }

  private final Kind kind;
  private final Path path;
  private final DecodeResult result;

  private OperationResult(Kind kind, Path path, DecodeResult result) {
    this.kind = Objects.requireNonNull(kind);
    this.path = Objects.requireNonNull(path);
    this.result = Objects.requireNonNull(result);
  }

  public static OperationResult thumbnailLoaded(Path path, DecodeResult result) {
    return new OperationResult(Kind.THUMBNAIL_LOADED, path, result);
  }

  public static OperationResult imageLoaded(Path path, DecodeResult result) {
    return new OperationResult(Kind.IMAGE_LOADED, path, result);
  }

  public Kind getKind() {
    return kind;
  }

  public Path getPath() {
    return path;
  }

  public DecodeResult getResult() {
    return result;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("kind", kind).add("path", path).add("result", result).toString();
  }

}
