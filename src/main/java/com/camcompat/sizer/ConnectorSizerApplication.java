package com.camcompat.sizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ConnectorSizerApplication {

  public static void main(String[] args) {
    SpringApplication.run(ConnectorSizerApplication.class, args);
  }
}
