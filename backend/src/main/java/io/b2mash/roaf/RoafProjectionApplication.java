package io.b2mash.roaf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RoafProjectionApplication {

  public static void main(String[] args) {
    SpringApplication.run(RoafProjectionApplication.class, args);
  }
}
