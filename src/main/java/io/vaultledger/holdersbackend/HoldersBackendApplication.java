package io.vaultledger.holdersbackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HoldersBackendApplication {

  public static void main(String[] args) {
    SpringApplication.run(HoldersBackendApplication.class, args);
  }
}
