package imview.watch;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import imview.RawEvent;

/**
 * Folds bursts of native changes into one {@link RawEvent} per path, released once the
 * path has been quiet for the debounce window.
 *
 * For example a create followed by writes is a single create, a create followed by a
 * delete is nothing at all, and a delete followed by a create is a write. A delete and a
 * create whose files share a file key (inode) are reported as one rename.
 *
 * Not thread-safe; owned by the debouncer thread.
 */
class ChangeCoalescer {

  private final long windowNanos;
  // insertion ordered, so events come out in the order their paths first changed
  private final Map<Path, Pending> pending = new LinkedHashMap<>();
  private final Map<Path, Object> fileKeys = new HashMap<>();

  ChangeCoalescer(Duration window) {
    this.windowNanos = window.toNanos();
  }

  /** Seeds the file key of an entry that existed before the watch started. */
  void remember(Path path, Object fileKey) {
    if (fileKey != null) {
      fileKeys.put(path, fileKey);
    }
  }

  void add(NativeChange change, long now) {
    switch (change.kind) {
      case CREATED:
        onCreated(change.path, change.fileKey, now);
        break;
      case MODIFIED:
        onModified(change.path, now);
        break;
      case DELETED:
        onDeleted(change.path, now);
        break;
      case OVERFLOW:
        put(change.path, new Pending(RawEvent.Kind.OTHER, now));
        break;
      default:
        throw new IllegalStateException("Unhandled change " + change);
    }
  }

  /** @return how long until the oldest pending path settles, or {@code null} if nothing is pending */
  Duration timeUntilNextFlush(long now) {
    Long earliest = null;
    for (Pending p : pending.values()) {
      long remaining = p.lastChange + windowNanos - now;
      earliest = earliest == null ? remaining : Math.min(earliest, remaining);
    }
    return earliest == null ? null : Duration.ofNanos(Math.max(earliest, 0));
  }

  /** Removes and returns the events for every path that has been quiet for the window. */
  List<RawEvent> flush(long now) {
    return flush(now, false);
  }

  /** Removes and returns every pending event, settled or not. */
  List<RawEvent> flushAll() {
    return flush(0, true);
  }

  boolean isEmpty() {
    return pending.isEmpty();
  }

  private List<RawEvent> flush(long now, boolean all) {
    List<RawEvent> events = new ArrayList<>();
    for (Iterator<Map.Entry<Path, Pending>> i = pending.entrySet().iterator(); i.hasNext();) {
      Map.Entry<Path, Pending> e = i.next();
      Pending p = e.getValue();
      if (all || now - p.lastChange >= windowNanos) {
        events.add(p.toEvent(e.getKey()));
        i.remove();
      }
    }
    return events;
  }

  private void onCreated(Path path, Object fileKey, long now) {
    Path renamedFrom = fileKey == null ? null : findPendingRemoval(fileKey);
    remember(path, fileKey);
    // recreated in place with a reused inode is a write, not a rename onto itself
    if (renamedFrom != null && !renamedFrom.equals(path)) {
      pending.remove(renamedFrom);
      Pending rename = new Pending(RawEvent.Kind.RENAME, now);
      rename.renamedFrom = renamedFrom;
      put(path, rename);
      return;
    }
    Pending existing = pending.get(path);
    if (existing == null) {
      put(path, new Pending(RawEvent.Kind.CREATE, now));
    } else if (existing.kind == RawEvent.Kind.REMOVE) {
      // replaced in place, e.g. an editor's safe write
      existing.kind = RawEvent.Kind.WRITE;
      existing.lastChange = now;
    } else {
      existing.lastChange = now;
    }
  }

  private void onModified(Path path, long now) {
    Pending existing = pending.get(path);
    if (existing == null) {
      put(path, new Pending(RawEvent.Kind.WRITE, now));
    } else {
      if (existing.kind == RawEvent.Kind.REMOVE) {
        existing.kind = RawEvent.Kind.WRITE;
      }
      existing.lastChange = now;
    }
  }

  private void onDeleted(Path path, long now) {
    Object fileKey = fileKeys.remove(path);
    Pending existing = pending.get(path);
    if (existing != null && existing.kind == RawEvent.Kind.CREATE) {
      // came and went within one window
      pending.remove(path);
      return;
    }
    if (existing != null && existing.kind == RawEvent.Kind.RENAME) {
      // renamed and then deleted, so what's gone is the original
      pending.remove(path);
      Pending removal = new Pending(RawEvent.Kind.REMOVE, now);
      removal.fileKey = fileKey;
      put(existing.renamedFrom, removal);
      return;
    }
    Pending removal = new Pending(RawEvent.Kind.REMOVE, now);
    removal.fileKey = fileKey;
    put(path, removal);
  }

  private Path findPendingRemoval(Object fileKey) {
    for (Map.Entry<Path, Pending> e : pending.entrySet()) {
      Pending p = e.getValue();
      if (p.kind == RawEvent.Kind.REMOVE && Objects.equals(p.fileKey, fileKey)) {
        return e.getKey();
      }
    }
    return null;
  }

  private void put(Path path, Pending p) {
    // re-insert so that the path moves to the end of the flush order
    pending.remove(path);
    pending.put(path, p);
  }

  private static class Pending {
    private RawEvent.Kind kind;
    private long lastChange;
    private Object fileKey;
    private Path renamedFrom;

    private Pending(RawEvent.Kind kind, long lastChange) {
      this.kind = kind;
      this.lastChange = lastChange;
    }

    private RawEvent toEvent(Path path) {
      switch (kind) {
        case CREATE:
          return RawEvent.create(path);
        case WRITE:
          return RawEvent.write(path);
        case REMOVE:
          return RawEvent.remove(path);
        case RENAME:
          return RawEvent.rename(renamedFrom, path);
        default:
          return RawEvent.other(path);
      }
    }
  }

}
