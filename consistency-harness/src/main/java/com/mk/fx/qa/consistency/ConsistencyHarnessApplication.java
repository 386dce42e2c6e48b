package com.mk.fx.qa.consistency;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ConsistencyHarnessApplication {

  public static void main(String[] args) {
    SpringApplication.run(ConsistencyHarnessApplication.class, args);
  }
}
