package com.delta.autoapply;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AutoApplyApplication {

  public static void main(String[] args) {
    SpringApplication.run(AutoApplyApplication.class, args);
  }
}
