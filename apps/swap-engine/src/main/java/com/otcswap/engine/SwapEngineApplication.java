package com.otcswap.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SwapEngineApplication {
  public static void main(String[] args) {
    SpringApplication.run(SwapEngineApplication.class, args);
  }
}
