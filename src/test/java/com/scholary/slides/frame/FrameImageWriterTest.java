package com.scholary.slides.frame;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

class FrameImageWriterTest {

  @TempDir Path tempDir;

  private final FrameImageWriter writer = new FrameImageWriter();

  @Test
  void writePages_shouldWriteNumberedPngsInOrder() throws Exception {
    Frame first = TestFrames.gray(1.0, 8, 6, 10);
    Frame second = TestFrames.checkerboard(2.0, 8, 6, 2);
    try {
      List<Path> pages = writer.writePages(List.of(first, second), tempDir.resolve("slides"));

      assertThat(pages)
          .containsExactly(
              tempDir.resolve("slides/page_001.png"), tempDir.resolve("slides/page_002.png"));
      assertThat(pages).allMatch(Files::isRegularFile);

      Mat decoded = Imgcodecs.imread(pages.get(0).toString(), Imgcodecs.IMREAD_GRAYSCALE);
      assertThat(decoded.cols()).isEqualTo(8);
      assertThat(decoded.rows()).isEqualTo(6);
      decoded.release();
    } finally {
      first.close();
      second.close();
    }
  }

  @Test
  void writePages_shouldCreateEmptyDirectoryForNoFrames() throws Exception {
    List<Path> pages = writer.writePages(List.of(), tempDir.resolve("empty"));

    assertThat(pages).isEmpty();
    assertThat(tempDir.resolve("empty")).isDirectory();
  }
}
