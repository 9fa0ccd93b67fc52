package com.scholary.audiosummary;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AudioSummaryApplication {

  public static void main(String[] args) {
    SpringApplication.run(AudioSummaryApplication.class, args);
  }
}
