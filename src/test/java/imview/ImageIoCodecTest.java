package imview;

import static imview.TestUtils.freshDirectory;
import static imview.TestUtils.writeImage;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.awt.image.BufferedImage;
import java.io.File;

import org.junit.Test;

public class ImageIoCodecTest {

  private final ImageIoCodec codec = new ImageIoCodec();

  @Test
  public void fitWithinFloorsBothDimensions() {
    assertThat(ImageCodec.fitWithin(400, 300, 150), is(new int[] { 150, 112 }));
    assertThat(ImageCodec.fitWithin(300, 400, 150), is(new int[] { 112, 150 }));
    assertThat(ImageCodec.fitWithin(100, 100, 150), is(new int[] { 150, 150 }));
  }

  @Test
  public void fitWithinKeepsTheLongerSideExact() {
    assertThat(ImageCodec.fitWithin(562, 421, 150), is(new int[] { 150, 112 }));
    assertThat(ImageCodec.fitWithin(281, 200, 150), is(new int[] { 150, 106 }));
    assertThat(ImageCodec.fitWithin(291, 200, 150), is(new int[] { 150, 103 }));
    assertThat(ImageCodec.fitWithin(421, 562, 150), is(new int[] { 112, 150 }));
    assertThat(ImageCodec.fitWithin(161, 100, 100), is(new int[] { 100, 62 }));
  }

  @Test
  public void resizeOfAnAwkwardWidthFillsTheBox() {
    BufferedImage resized = codec.resizeToFit(new BufferedImage(562, 421, BufferedImage.TYPE_INT_ARGB), 150);
    assertThat(resized.getWidth(), is(150));
    assertThat(resized.getHeight(), is(112));
  }

  @Test
  public void fitWithinNeverCollapsesToZero() {
    assertThat(ImageCodec.fitWithin(10000, 1, 150), is(new int[] { 150, 1 }));
  }

  @Test
  public void decodesToArgb() throws Exception {
    File dir = freshDirectory("ImageIoCodecTest");
    BufferedImage image = codec.decode(writeImage(new File(dir, "a.jpg"), 8, 6).toPath());
    assertThat(image.getType(), is(BufferedImage.TYPE_INT_ARGB));
    assertThat(image.getWidth(), is(8));
  }

  @Test
  public void resizesSmallImagesUp() {
    BufferedImage image = codec.resizeToFit(new BufferedImage(10, 20, BufferedImage.TYPE_INT_ARGB), 40);
    assertThat(image.getWidth(), is(20));
    assertThat(image.getHeight(), is(40));
  }

  @Test
  public void recognizesImagesByExtension() {
    assertThat(ImageFormats.isImage(new File("a.png").toPath()), is(true));
    assertThat(ImageFormats.isImage(new File("A.JPG").toPath()), is(true));
    assertThat(ImageFormats.isImage(new File("a.txt").toPath()), is(false));
    assertThat(ImageFormats.isImage(new File("png").toPath()), is(false));
  }

}
