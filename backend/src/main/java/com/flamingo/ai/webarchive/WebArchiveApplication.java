package com.flamingo.ai.webarchive;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the web archive backend. */
@SpringBootApplication
public class WebArchiveApplication {

  public static void main(String[] args) {
    SpringApplication.run(WebArchiveApplication.class, args);
  }
}
