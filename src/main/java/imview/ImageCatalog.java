package imview;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A consumer of {@link ImageFileSystem#events()} that keeps track of which images exist and
 * what has been loaded for them.
 *
 * Paths go {@code unknown -> tracked} on ADDED, stay tracked through MODIFIED, move on
 * RENAMED and go back to unknown on REMOVED. Events about paths we don't track (e.g. the
 * removal of a non-image file) are ignored. A failed decode is kept like any other result,
 * so the caller can show an error instead of a spinner.
 */
public class ImageCatalog {

  private static final Logger log = LoggerFactory.getLogger(ImageCatalog.class);
  private final ImageFileSystem fileSystem;
  private final int thumbnailSize;
  private final List<Path> files = new ArrayList<>();
  private final Map<Path, DecodeResult> thumbnails = new HashMap<>();
  private final Map<Path, DecodeResult> images = new HashMap<>();

  public ImageCatalog(ImageFileSystem fileSystem, int thumbnailSize) {
    this.fileSystem = fileSystem;
    this.thumbnailSize = thumbnailSize;
  }

  /** Drains whatever is ready on the event stream; returns how many events were applied. */
  public int poll() {
    List<OutputEvent> ready = new ArrayList<>();
    fileSystem.events().drainTo(ready);
    ready.forEach(this::apply);
    return ready.size();
  }

  public void apply(OutputEvent event) {
    switch (event.getKind()) {
      case FILE:
        apply(event.getFileEvent());
        break;
      case OPERATION:
        apply(event.getOperationResult());
        break;
      default:
        throw new IllegalStateException("Unhandled event " + event);
    }
  }

  private void apply(FileEvent event) {
    Path path = event.getPath();
    switch (event.getKind()) {
      case ADDED:
        log.trace("File added: {}", path);
        if (!files.contains(path)) {
          files.add(path);
          Collections.sort(files);
        }
        fileSystem.readThumbnail(path, thumbnailSize);
        break;
      case MODIFIED:
        log.trace("File modified: {}", path);
        if (files.contains(path)) {
          boolean hadImage = images.containsKey(path);
          invalidate(path);
          fileSystem.readThumbnail(path, thumbnailSize);
          if (hadImage) {
            fileSystem.readFile(path);
          }
        }
        break;
      case REMOVED:
        log.trace("File removed: {}", path);
        files.remove(path);
        invalidate(path);
        break;
      case RENAMED:
        log.trace("File renamed: {} -> {}", path, event.getNewPath());
        rename(path, event.getNewPath());
        break;
      default:
        throw new IllegalStateException("Unhandled event " + event);
    }
  }

  private void apply(OperationResult result) {
    Path path = result.getPath();
    if (!files.contains(path)) {
      log.debug("Ignoring {} for untracked {}", result.getKind(), path);
      return;
    }
    if (!result.getResult().isSuccess()) {
      log.warn("Failed to load {} for {}: {}", result.getKind(), path, result.getResult().getError().getMessage());
    }
    switch (result.getKind()) {
      case THUMBNAIL_LOADED:
        thumbnails.put(path, result.getResult());
        break;
      case IMAGE_LOADED:
        images.put(path, result.getResult());
        break;
      default:
        throw new IllegalStateException("Unhandled result " + result);
    }
  }

  private void rename(Path oldPath, Path newPath) {
    int index = files.indexOf(oldPath);
    if (index == -1) {
      return;
    }
    if (!oldPath.equals(newPath) && files.contains(newPath)) {
      // renamed over another image, which is gone now
      files.remove(newPath);
      invalidate(newPath);
      index = files.indexOf(oldPath);
    }
    files.set(index, newPath);
    Collections.sort(files);
    DecodeResult thumbnail = thumbnails.remove(oldPath);
    if (thumbnail != null) {
      thumbnails.put(newPath, thumbnail);
    }
    DecodeResult image = images.remove(oldPath);
    if (image != null) {
      images.put(newPath, image);
    }
  }

  private void invalidate(Path path) {
    thumbnails.remove(path);
    images.remove(path);
  }

  /** @return the tracked images, sorted */
  public List<Path> getFiles() {
    return Collections.unmodifiableList(files);
  }

  public boolean isTracked(Path path) {
    return files.contains(path);
  }

  public Optional<DecodeResult> getThumbnail(Path path) {
    return Optional.ofNullable(thumbnails.get(path));
  }

  public Optional<DecodeResult> getImage(Path path) {
    return Optional.ofNullable(images.get(path));
  }

}
