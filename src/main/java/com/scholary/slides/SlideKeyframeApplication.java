package com.scholary.slides;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class SlideKeyframeApplication {

  public static void main(String[] args) {
    SpringApplication.run(SlideKeyframeApplication.class, args);
  }
}
