package com.scholary.slides.media;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class VideoSourceTest {

  private static final CropRegion RIGHT_HALF = new CropRegion(0.5, 0, 0.5, 1);

  @Test
  void videoFilter_shouldBeEmptyForUncroppedVideoWithoutFilters() {
    VideoSource video = new VideoSource(Path.of("a.mp4"), null, 10, 25);

    assertThat(video.isCropped()).isFalse();
    assertThat(video.videoFilter()).isEmpty();
  }

  @Test
  void videoFilter_shouldPutCropFirst() {
    VideoSource video = new VideoSource(Path.of("a.mp4"), RIGHT_HALF, 10, 25);

    assertThat(video.videoFilter("showinfo"))
        .contains("crop=iw*0.500000:ih*1.000000:iw*0.500000:ih*0.000000,showinfo");
  }

  @Test
  void uncropped_shouldKeepProbeData() {
    VideoSource video = new VideoSource(Path.of("a.mp4"), RIGHT_HALF, 10, 25);

    VideoSource full = video.uncropped();

    assertThat(full.isCropped()).isFalse();
    assertThat(full.path()).isEqualTo(video.path());
    assertThat(full.durationSeconds()).isEqualTo(10);
    assertThat(full.frameRate()).isEqualTo(25);
  }
}
