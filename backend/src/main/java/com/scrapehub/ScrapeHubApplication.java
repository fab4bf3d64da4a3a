package com.scrapehub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ScrapeHubApplication {

  public static void main(String[] args) {
    SpringApplication.run(ScrapeHubApplication.class, args);
  }
}
