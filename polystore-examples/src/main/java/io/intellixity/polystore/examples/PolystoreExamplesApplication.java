package io.intellixity.polystore.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class PolystoreExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(PolystoreExamplesApplication.class, args);
  }
}
