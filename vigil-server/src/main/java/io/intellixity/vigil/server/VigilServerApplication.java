package io.intellixity.vigil.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class VigilServerApplication {
  public static void main(String[] args) {
    SpringApplication.run(VigilServerApplication.class, args);
  }
}
