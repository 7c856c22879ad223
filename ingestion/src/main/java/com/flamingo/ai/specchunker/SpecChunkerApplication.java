package com.flamingo.ai.specchunker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Command-line entry point: ingests specification PDFs into JSON Lines chunk files. */
@SpringBootApplication
public class SpecChunkerApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(SpecChunkerApplication.class, args)));
  }
}
