package ripsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RipsearchApplication {
  public static void main(String[] args) {
    SpringApplication.run(RipsearchApplication.class, args);
  }
}
