package imview;

import java.nio.file.Path;
import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * A notification from the directory watcher, before any classification.
 *
 * {@link #getPath()} is the affected entry; for renames it is the old path and
 * {@link #getNewPath()} is the new one.
 */
public final class RawEvent {

  public enum Kind {
    CREATE, WRITE, REMOVE, RENAME, OTHER
  }

  private final Kind kind;
  private final Path path;
  private final Path newPath;

  private RawEvent(Kind kind, Path path, Path newPath) {
    this.kind = Objects.requireNonNull(kind);
    this.path = Objects.requireNonNull(path);
    this.newPath = newPath;
  }

  public static RawEvent create(Path path) {
    return new RawEvent(Kind.CREATE, path, null);
  }

  public static RawEvent write(Path path) {
    return new RawEvent(Kind.WRITE, path, null);
  }

  public static RawEvent remove(Path path) {
    return new RawEvent(Kind.REMOVE, path, null);
  }

  public static RawEvent rename(Path oldPath, Path newPath) {
    return new RawEvent(Kind.RENAME, oldPath, Objects.requireNonNull(newPath));
  }

  public static RawEvent other(Path path) {
    return new RawEvent(Kind.OTHER, path, null);
  }

  public Kind getKind() {
    return kind;
  }

  public Path getPath() {
    return path;
  }

  /** @return the destination of a {@link Kind#RENAME}, otherwise {@code null} */
  public Path getNewPath() {
    return newPath;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof RawEvent)) {
      return false;
    }
    RawEvent other = (RawEvent) o;
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
