package imview;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSortedSet;

/** The outcome of {@link PathResolver#resolve}: the initial image files and the directory to watch, if any. */
public final class ResolvedPaths {

  private static final ResolvedPaths EMPTY = new ResolvedPaths(Optional.empty(), ImmutableSortedSet.of());
  private final Optional<Path> root;
  private final ImmutableSortedSet<Path> files;

  ResolvedPaths(Optional<Path> root, Set<Path> files) {
    this.root = root;
    this.files = ImmutableSortedSet.copyOf(files);
  }

  static ResolvedPaths empty() {
    return EMPTY;
  }

  /** @return the single directory to watch, present only if every input collapsed to it */
  public Optional<Path> getRoot() {
    return root;
  }

  /** @return canonical image paths, sorted */
  public ImmutableSortedSet<Path> getFiles() {
    return files;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("root", root.orElse(null)).add("files", files.size()).toString();
  }

}
