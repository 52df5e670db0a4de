package io.b2mash.worldtax;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorldTaxApplication {

  public static void main(String[] args) {
    SpringApplication.run(WorldTaxApplication.class, args);
  }
}
