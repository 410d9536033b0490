package com.paygate.gateapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GateApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(GateApiApplication.class, args);
  }
}
