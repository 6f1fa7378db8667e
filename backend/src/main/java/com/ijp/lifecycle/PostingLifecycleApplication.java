package com.ijp.lifecycle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PostingLifecycleApplication {

  public static void main(String[] args) {
    SpringApplication.run(PostingLifecycleApplication.class, args);
  }
}
