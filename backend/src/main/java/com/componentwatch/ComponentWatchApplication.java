package com.componentwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ComponentWatchApplication {

  public static void main(String[] args) {
    SpringApplication.run(ComponentWatchApplication.class, args);
  }
}
