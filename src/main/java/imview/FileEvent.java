package imview;

import java.nio.file.Path;
import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * A classified change to the set of image files, in the shape consumers see.
 *
 * The service only emits these transitions; tracking which paths are currently known
 * is up to the consumer.
 */
public final class FileEvent {

  public enum Kind {
    ADDED, REMOVED, MODIFIED, RENAMED
  }

  private final Kind kind;
  private final Path path;
  private final Path newPath;

  private FileEvent(Kind kind, Path path, Path newPath) {
    this.kind = Objects.requireNonNull(kind);
    this.path = Objects.requireNonNull(path);
    this.newPath = newPath;
  }

  public static FileEvent added(Path path) {
    return new FileEvent(Kind.ADDED, path, null);
  }

  public static FileEvent removed(Path path) {
    return new FileEvent(Kind.REMOVED, path, null);
  }

  public static FileEvent modified(Path path) {
    return new FileEvent(Kind.MODIFIED, path, null);
  }

  public static FileEvent renamed(Path oldPath, Path newPath) {
    return new FileEvent(Kind.RENAMED, oldPath, Objects.requireNonNull(newPath));
  }

  public Kind getKind() {
    return kind;
  }

  /** @return the affected path, or the old path of a rename */
  public Path getPath() {
    return path;
  }

  /** @return the new path of a rename, otherwise {@code null} */
  public Path getNewPath() {
    return newPath;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof FileEvent)) {
      return false;
    }
    FileEvent other = (FileEvent) o;
    return kind == other.kind && path.equals(other.path) && Objects.equals(newPath, other.newPath);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, path, newPath);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).omitNullValues().add("kind", kind).add("path", path).add("newPath", newPath).toString();
  }

}
