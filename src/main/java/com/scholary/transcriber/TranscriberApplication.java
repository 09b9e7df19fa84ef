package com.scholary.transcriber;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TranscriberApplication {

  public static void main(String[] args) {
    SpringApplication.run(TranscriberApplication.class, args);
  }
}
