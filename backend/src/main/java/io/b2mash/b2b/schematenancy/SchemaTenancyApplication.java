package io.b2mash.b2b.schematenancy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SchemaTenancyApplication {

  public static void main(String[] args) {
    SpringApplication.run(SchemaTenancyApplication.class, args);
  }
}
