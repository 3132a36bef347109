package com.flamingo.ai.pdfquiz;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Entry point for the PDF quiz and chat service. */
@SpringBootApplication
@EnableScheduling
public class PdfQuizApplication {

  public static void main(String[] args) {
    SpringApplication.run(PdfQuizApplication.class, args);
  }
}
