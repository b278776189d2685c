package imview;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import javax.imageio.ImageIO;

import org.apache.commons.io.FileUtils;

public class TestUtils {

  /** @return an empty directory under ./target, wiping whatever a previous run left there */
  public static File freshDirectory(String name) throws IOException {
    File dir = new File("./target/" + name);
    if (dir.exists()) {
      FileUtils.forceDelete(dir);
    }
    dir.mkdirs();
    return dir;
  }

  public static File writeImage(File file, int width, int height) throws IOException {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = image.createGraphics();
    g.setColor(Color.ORANGE);
    g.fillRect(0, 0, width, height);
    g.dispose();
    String format = file.getName().substring(file.getName().lastIndexOf('.') + 1);
    if (!ImageIO.write(image, format, file)) {
      throw new IllegalArgumentException("No writer for " + format);
    }
    return file;
  }

  public static File writeStringToFile(File file, String data) throws IOException {
    FileUtils.writeStringToFile(file, data, UTF_8);
    return file;
  }

  /** Collects events until {@code done} is satisfied by the collected list, or fails after 10 seconds. */
  public static List<OutputEvent> collectUntil(EventStream<OutputEvent> events, Predicate<List<OutputEvent>> done) throws InterruptedException {
    List<OutputEvent> collected = new ArrayList<>();
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (!done.test(collected)) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("Timed out, only saw " + collected);
      }
      OutputEvent e = events.poll();
      if (e == null) {
        Thread.sleep(10);
      } else {
        collected.add(e);
      }
    }
    return collected;
  }

  /** Waits for {@code events} to be closed, collecting whatever was still in it. */
  public static List<OutputEvent> drainUntilClosed(EventStream<OutputEvent> events) throws InterruptedException {
    List<OutputEvent> collected = new ArrayList<>();
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (true) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("Stream never closed, saw " + collected);
      }
      OutputEvent e = events.poll();
      if (e != null) {
        collected.add(e);
      } else if (events.isClosed()) {
        return collected;
      } else {
        Thread.sleep(10);
      }
    }
  }

  public static long count(List<OutputEvent> events, OperationResult.Kind kind) {
    return events.stream().filter(e -> e.getKind() == OutputEvent.Kind.OPERATION && e.getOperationResult().getKind() == kind).count();
  }

  public static long count(List<OutputEvent> events, FileEvent.Kind kind) {
    return events.stream().filter(e -> e.getKind() == OutputEvent.Kind.FILE && e.getFileEvent().getKind() == kind).count();
  }

}
