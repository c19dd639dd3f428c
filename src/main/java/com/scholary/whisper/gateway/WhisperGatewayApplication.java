package com.scholary.whisper.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class WhisperGatewayApplication {

  public static void main(String[] args) {
    SpringApplication.run(WhisperGatewayApplication.class, args);
  }
}
