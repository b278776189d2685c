package imview;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Semaphore;

import org.jooq.lambda.Seq;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.rvesse.airline.annotations.Arguments;
import com.github.rvesse.airline.annotations.Cli;
import com.github.rvesse.airline.annotations.Command;
import com.github.rvesse.airline.annotations.Option;
import com.github.rvesse.airline.help.Help;

import imview.ImageView.WatchCommand;

@Cli(name = "imview", description = "loads and watches a directory of images", commands = { WatchCommand.class, Help.class }, defaultCommand = Help.class)
public class ImageView {

  private static final Logger log = LoggerFactory.getLogger(ImageView.class);
  private static final int defaultThumbnailSize = 150;

  static {
    LoggingConfig.init();
  }

  public static void main(String[] args) throws Exception {
    com.github.rvesse.airline.Cli<Runnable> cli = new com.github.rvesse.airline.Cli<>(ImageView.class);
    cli.parse(args).run();
  }

  @Command(name = "watch", description = "loads the given images (or directories of images), then logs every change until interrupted")
  public static class WatchCommand implements Runnable {
    @Arguments(description = "image files and/or directories, default: the current directory")
    public List<String> paths = new ArrayList<>();

    @Option(name = { "-s", "--thumbnail-size" }, description = "thumbnail box size in pixels, default: " + defaultThumbnailSize)
    public int thumbnailSize = defaultThumbnailSize;

    @Option(name = { "--debounce-seconds" }, description = "how long a file must be quiet before a change is reported, default: 10")
    public int debounceSeconds = 10;

    @Option(name = { "--trace" }, description = "log every event")
    public boolean trace;

    @Option(name = { "--enable-log-file" }, description = "enables logging debug statements to imview.log")
    public boolean enableLogFile;

    @Override
    public void run() {
      if (trace) {
        LoggingConfig.initWithTracing();
      }
      if (enableLogFile) {
        LoggingConfig.enableLogFile();
      }
      List<Path> inputs = paths.isEmpty() ? Seq.of(Paths.get(".")).toList() : Seq.seq(paths).map(p -> Paths.get(p)).toList();
      Semaphore wakeups = new Semaphore(0);
      ImageFileSystem fs;
      try {
        fs = ImageFileSystem.start(inputs, wakeups::release, ImageFileSystem.Options.defaults().withDebounceWindow(Duration.ofSeconds(debounceSeconds)));
      } catch (IOException e) {
        log.error("Could not open " + inputs + ": " + e.getMessage(), e);
        System.exit(-1);
        return;
      }
      Runtime.getRuntime().addShutdownHook(new Thread(fs::shutdown, "imview-shutdown"));
      log.info("Started, watching " + fs.getWatchedRoot().map(Path::toString).orElse("nothing"));

      ImageCatalog catalog = new ImageCatalog(fs, thumbnailSize);
      Path requested = null;
      try {
        // the initial Added events are already queued, so drain once before waiting
        while (true) {
          wakeups.drainPermits();
          if (catalog.poll() > 0) {
            log.info("Tracking " + catalog.getFiles().size() + " images");
          }
          // like a viewer would, keep the first image loaded at full size
          if (!catalog.getFiles().isEmpty()) {
            Path current = catalog.getFiles().get(0);
            if (!current.equals(requested)) {
              requested = current;
              fs.readFile(current);
            }
          }
          wakeups.acquire();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

}
