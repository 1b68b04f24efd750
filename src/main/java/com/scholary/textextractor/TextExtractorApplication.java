package com.scholary.textextractor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class TextExtractorApplication {

  public static void main(String[] args) {
    SpringApplication.run(TextExtractorApplication.class, args);
  }
}
