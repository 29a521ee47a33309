package com.flamingo.ai.ragindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the RAG indexing and retrieval service. */
@SpringBootApplication
public class RagIndexApplication {

  public static void main(String[] args) {
    SpringApplication.run(RagIndexApplication.class, args);
  }
}
