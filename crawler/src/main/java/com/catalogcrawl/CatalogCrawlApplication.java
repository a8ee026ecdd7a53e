package com.catalogcrawl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CatalogCrawlApplication {

  public static void main(String[] args) {
    SpringApplication.run(CatalogCrawlApplication.class, args);
  }
}
