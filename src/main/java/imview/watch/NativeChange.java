package imview.watch;

import java.nio.file.Path;

import com.google.common.base.MoreObjects;

/** One undebounced event as reported by the {@link java.nio.file.WatchService}. */
final class NativeChange {

  enum Kind {
    CREATED, MODIFIED, DELETED, OVERFLOW
  }

  final Kind kind;
  final Path path;
  /** The created file's key (inode), if we could read one. */
  final Object fileKey;

  NativeChange(Kind kind, Path path, Object fileKey) {
    this.kind = kind;
    this.path = path;
    this.fileKey = fileKey;
  }

  static NativeChange created(Path path, Object fileKey) {
    return new NativeChange(Kind.CREATED, path, fileKey);
  }

  static NativeChange modified(Path path) {
    return new NativeChange(Kind.MODIFIED, path, null);
  }

  static NativeChange deleted(Path path) {
    return new NativeChange(Kind.DELETED, path, null);
  }

  static NativeChange overflow(Path root) {
    return new NativeChange(Kind.OVERFLOW, root, null);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).omitNullValues().add("kind", kind).add("path", path).add("fileKey", fileKey).toString();
  }

}
