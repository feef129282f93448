package com.scholary.slides.frame;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes frames as numbered PNG pages ({@code page_001.png}, {@code page_002.png}, ...).
 *
 * <p>The page directory is what the downstream document assembler consumes; page order is display
 * order.
 */
@Component
public class FrameImageWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(FrameImageWriter.class);

  public FrameImageWriter() {
    OpenCvLoader.ensureLoaded();
  }

  /**
   * Write frames into a directory, creating it if needed.
   *
   * @param frames readable frames in display order
   * @param directory target directory
   * @return the written page paths, in order
   * @throws IOException if the directory cannot be created or a page cannot be encoded
   */
  public List<Path> writePages(List<Frame> frames, Path directory) throws IOException {
    Files.createDirectories(directory);
    List<Path> pages = new ArrayList<>(frames.size());
    for (int i = 0; i < frames.size(); i++) {
      Path page = directory.resolve(String.format("page_%03d.png", i + 1));
      if (!Imgcodecs.imwrite(page.toString(), frames.get(i).image())) {
        throw new IOException("Failed to encode page: " + page);
      }
      pages.add(page);
    }
    LOGGER.info("Wrote {} pages to {}", pages.size(), directory);
    return pages;
  }
}
