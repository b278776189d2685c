package imview;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the paths given on startup into the initial set of image files, and picks the
 * directory to watch.
 *
 * A directory is only watched if all the inputs point at exactly one directory, either
 * because it was given explicitly or because it is the parent of every given file. Inputs
 * spread over several directories are loaded, but not watched.
 */
public class PathResolver {

  private static final Logger log = LoggerFactory.getLogger(PathResolver.class);
  private final Predicate<Path> isImage;

  public PathResolver(Predicate<Path> isImage) {
    this.isImage = isImage;
  }

  public ResolvedPaths resolve(Collection<Path> paths) throws IOException {
    if (paths.isEmpty()) {
      return ResolvedPaths.empty();
    }

    List<Path> explicitFiles = new ArrayList<>();
    List<Path> explicitDirs = new ArrayList<>();
    for (Path path : paths) {
      Path real = path.toRealPath();
      if (Files.isRegularFile(real)) {
        explicitFiles.add(real);
      } else if (Files.isDirectory(real)) {
        explicitDirs.add(real);
      } else {
        log.debug("Skipping {}, neither a file nor a directory", real);
      }
    }

    Set<Path> files = new HashSet<>();
    explicitFiles.stream().filter(isImage).forEach(files::add);
    for (Path dir : explicitDirs) {
      files.addAll(listImages(dir));
    }

    Set<Path> candidateRoots = new HashSet<>(explicitDirs);
    for (Path file : files) {
      Path parent = file.getParent();
      if (parent != null) {
        candidateRoots.add(parent);
      }
    }

    Optional<Path> root = Optional.empty();
    if (candidateRoots.size() == 1) {
      root = Optional.of(candidateRoots.iterator().next());
      // rescan, as files may have shown up since we listed the explicit directories
      files.addAll(listImages(root.get()));
    } else {
      log.debug("Not watching, inputs span {} directories", candidateRoots.size());
    }
    return new ResolvedPaths(root, files);
  }

  /** Lists the image files directly inside {@code dir}, canonicalized; does not recurse. */
  private List<Path> listImages(Path dir) throws IOException {
    List<Path> images = new ArrayList<>();
    try (Stream<Path> entries = Files.list(dir)) {
      for (Path entry : (Iterable<Path>) entries::iterator) {
        Path real = entry.toRealPath();
        if (Files.isRegularFile(real) && isImage.test(real)) {
          images.add(real);
        }
      }
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
    return images;
  }

}
