package de.example.py2cs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class Py2CsApplication {
  public static void main(String[] args) {
    SpringApplication.run(Py2CsApplication.class, args);
  }
}
