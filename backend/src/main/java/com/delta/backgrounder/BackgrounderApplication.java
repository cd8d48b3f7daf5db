package com.delta.backgrounder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BackgrounderApplication {

  public static void main(String[] args) {
    SpringApplication.run(BackgrounderApplication.class, args);
  }
}
