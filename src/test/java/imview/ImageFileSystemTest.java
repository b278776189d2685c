package imview;

import static imview.TestUtils.collectUntil;
import static imview.TestUtils.count;
import static imview.TestUtils.drainUntilClosed;
import static imview.TestUtils.freshDirectory;
import static imview.TestUtils.writeImage;
import static imview.TestUtils.writeStringToFile;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;

import java.io.File;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;

import com.google.common.collect.Lists;

import imview.ImageFileSystem.Options;
import imview.watch.StubDirectoryWatcher;

public class ImageFileSystemTest {

  @Rule
  public final LogCapture logs = new LogCapture();
  private final AtomicInteger notifications = new AtomicInteger();
  private File dir;
  private StubDirectoryWatcher stubWatcher;
  private ImageFileSystem fs;

  @Before
  public void clearFiles() throws Exception {
    dir = freshDirectory("ImageFileSystemTest");
  }

  @After
  public void shutdown() {
    if (fs != null) {
      fs.shutdown();
    }
    if (stubWatcher != null) {
      stubWatcher.close();
    }
  }

  @Test
  public void addsEachImageFoundAtStartup() throws Exception {
    // given three images and two other files
    writeImage(new File(dir, "a.png"), 10, 10);
    writeImage(new File(dir, "b.png"), 10, 10);
    writeImage(new File(dir, "c.jpg"), 10, 10);
    writeStringToFile(new File(dir, "notes.txt"), "hello");
    writeStringToFile(new File(dir, "Makefile"), "all:");
    // when
    startWithStubWatcher(dir.toPath());
    // then
    List<OutputEvent> events = collectUntil(fs.events(), l -> l.size() >= 3);
    assertThat(count(events, FileEvent.Kind.ADDED), is(3L));
    assertThat(addedNames(events), containsInAnyOrder("a.png", "b.png", "c.jpg"));
    assertThat(fs.getWatchedRoot(), is(Optional.of(dir.toPath().toRealPath())));
  }

  @Test
  public void watchesTheParentOfASingleFile() throws Exception {
    File a = writeImage(new File(dir, "a.png"), 10, 10);
    startWithStubWatcher(a.toPath());
    List<OutputEvent> events = collectUntil(fs.events(), l -> l.size() >= 1);
    assertThat(addedNames(events), containsInAnyOrder("a.png"));
    assertThat(fs.getWatchedRoot(), is(Optional.of(dir.toPath().toRealPath())));
  }

  @Test
  public void twoDirectoriesMeansNoWatch() throws Exception {
    File one = new File(dir, "one");
    File two = new File(dir, "two");
    one.mkdirs();
    two.mkdirs();
    writeImage(new File(one, "a.png"), 10, 10);
    writeImage(new File(two, "b.png"), 10, 10);
    Options options = Options.defaults().withDebounceWindow(Duration.ofMillis(200));
    fs = ImageFileSystem.start(Lists.newArrayList(one.toPath(), two.toPath()), notifications::incrementAndGet, options);
    List<OutputEvent> events = collectUntil(fs.events(), l -> l.size() >= 2);
    assertThat(addedNames(events), containsInAnyOrder("a.png", "b.png"));
    assertThat(fs.getWatchedRoot(), is(Optional.empty()));
    // and later changes go unnoticed
    writeImage(new File(one, "c.png"), 10, 10);
    writeImage(new File(two, "b.png"), 20, 20);
    Thread.sleep(1000);
    assertThat(fs.events().poll() == null, is(true));
    assertThat(notifications.get(), is(0));
  }

  @Test
  public void readsAThumbnail() throws Exception {
    Path a = writeImage(new File(dir, "a.png"), 400, 300).toPath().toRealPath();
    startWithStubWatcher(dir.toPath());
    fs.readThumbnail(a, 150);
    List<OutputEvent> events = collectUntil(fs.events(), l -> count(l, OperationResult.Kind.THUMBNAIL_LOADED) == 1);
    OperationResult result = find(events, OperationResult.Kind.THUMBNAIL_LOADED);
    assertThat(result.getPath(), is(a));
    assertThat(result.getResult().getImage().getWidth(), is(150));
    assertThat(result.getResult().getImage().getHeight(), is(112));
  }

  @Test
  public void readingAMissingFileIsOneFailedResult() throws Exception {
    startWithStubWatcher(dir.toPath());
    Path missing = dir.toPath().resolve("missing.png");
    fs.readFile(missing);
    List<OutputEvent> events = collectUntil(fs.events(), l -> count(l, OperationResult.Kind.IMAGE_LOADED) == 1);
    OperationResult result = find(events, OperationResult.Kind.IMAGE_LOADED);
    assertThat(result.getPath(), is(missing));
    assertThat(result.getResult().isSuccess(), is(false));
    assertThat(result.getResult().getError().getMessage(), containsString("missing.png"));
    // and nothing else shows up
    Thread.sleep(200);
    assertThat(fs.events().poll() == null, is(true));
  }

  @Test
  public void readingTwiceDecodesTwice() throws Exception {
    Path a = writeImage(new File(dir, "a.png"), 20, 20).toPath().toRealPath();
    startWithStubWatcher(dir.toPath());
    fs.readFile(a);
    fs.readFile(a);
    List<OutputEvent> events = collectUntil(fs.events(), l -> count(l, OperationResult.Kind.IMAGE_LOADED) == 2);
    assertThat(count(events, OperationResult.Kind.IMAGE_LOADED), is(2L));
  }

  @Test
  public void forwardsWatchEventsAndNotifies() throws Exception {
    startWithStubWatcher(dir.toPath());
    Path root = dir.toPath().toRealPath();
    // when the watcher sees an image come and a text file change
    stubWatcher.emit(RawEvent.create(root.resolve("new.png")));
    stubWatcher.emit(RawEvent.write(root.resolve("notes.txt")));
    stubWatcher.emit(RawEvent.rename(root.resolve("new.png"), root.resolve("renamed.png")));
    // then only the image events come through, each with one notification
    List<OutputEvent> events = collectUntil(fs.events(), l -> l.size() >= 2);
    assertThat(events.get(0).getFileEvent().getKind(), is(FileEvent.Kind.ADDED));
    assertThat(events.get(1).getFileEvent().getKind(), is(FileEvent.Kind.RENAMED));
    assertThat(events.get(1).getFileEvent().getNewPath(), is(root.resolve("renamed.png")));
    // the hook runs just after each send
    Thread.sleep(200);
    assertThat(notifications.get(), is(2));
  }

  @Test
  public void shutdownThenWatcherClosingIsQuiet() throws Exception {
    writeImage(new File(dir, "a.png"), 10, 10);
    startWithStubWatcher(dir.toPath());
    // when
    fs.shutdown();
    stubWatcher.close();
    // then the stream ends, and nobody complains
    List<OutputEvent> events = drainUntilClosed(fs.events());
    assertThat(count(events, FileEvent.Kind.ADDED), is(1L));
    assertThat(logs.errors(), is(empty()));
  }

  @Test
  public void watcherClosingWithoutShutdownIsAnError() throws Exception {
    startWithStubWatcher(dir.toPath());
    stubWatcher.close();
    drainUntilClosed(fs.events());
    assertThat(logs.errors(), hasItem("Directory watcher ended"));
  }

  @Test
  public void consumerLeavingEndsTheWatch() throws Exception {
    Path a = writeImage(new File(dir, "a.png"), 10, 10).toPath().toRealPath();
    startWithStubWatcher(dir.toPath());
    // when the consumer goes away, and the next result finds nobody to deliver to
    fs.events().close();
    fs.readFile(a);
    // then the funnel takes the watch down with it
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (!stubWatcher.events().isClosed()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("watcher still open");
      }
      Thread.sleep(10);
    }
    Thread.sleep(200);
    assertThat(logs.errors(), is(empty()));
  }

  @Test
  public void aRealWatcherSeesANewImage() throws Exception {
    fs = ImageFileSystem.start(Lists.newArrayList(dir.toPath()), notifications::incrementAndGet, Options.defaults().withDebounceWindow(Duration.ofMillis(200)));
    writeImage(new File(dir, "a.png"), 10, 10);
    List<OutputEvent> events = collectUntil(fs.events(), l -> count(l, FileEvent.Kind.ADDED) >= 1);
    assertThat(addedNames(events), containsInAnyOrder("a.png"));
  }

  private void startWithStubWatcher(Path path) throws Exception {
    Options options = Options.defaults().withWatcherFactory((root, window) -> {
      stubWatcher = new StubDirectoryWatcher(root);
      return stubWatcher;
    });
    fs = ImageFileSystem.start(Lists.newArrayList(path), notifications::incrementAndGet, options);
  }

  private static List<String> addedNames(List<OutputEvent> events) {
    return events
      .stream()
      .filter(e -> e.getKind() == OutputEvent.Kind.FILE && e.getFileEvent().getKind() == FileEvent.Kind.ADDED)
      .map(e -> e.getFileEvent().getPath().getFileName().toString())
      .collect(Collectors.toList());
  }

  private static OperationResult find(List<OutputEvent> events, OperationResult.Kind kind) {
    return events
      .stream()
      .filter(e -> e.getKind() == OutputEvent.Kind.OPERATION && e.getOperationResult().getKind() == kind)
      .map(OutputEvent::getOperationResult)
      .findFirst()
      .get();
  }

}
