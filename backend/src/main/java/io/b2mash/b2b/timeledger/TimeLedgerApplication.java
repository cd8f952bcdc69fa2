package io.b2mash.b2b.timeledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TimeLedgerApplication {

  public static void main(String[] args) {
    SpringApplication.run(TimeLedgerApplication.class, args);
  }
}
