package com.baleen.corpus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BaleenApplication {

  public static void main(String[] args) {
    SpringApplication.run(BaleenApplication.class, args);
  }
}
