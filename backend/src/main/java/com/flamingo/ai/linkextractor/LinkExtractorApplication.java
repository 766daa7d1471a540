package com.flamingo.ai.linkextractor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the link extractor back end. */
@SpringBootApplication
public class LinkExtractorApplication {

  public static void main(String[] args) {
    SpringApplication.run(LinkExtractorApplication.class, args);
  }
}
