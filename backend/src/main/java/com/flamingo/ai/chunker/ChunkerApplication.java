package com.flamingo.ai.chunker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the document chunking service. */
@SpringBootApplication
public class ChunkerApplication {

  public static void main(String[] args) {
    SpringApplication.run(ChunkerApplication.class, args);
  }
}
