package com.foo.sheetimport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SheetImportApplication {

  public static void main(String[] args) {
    SpringApplication.run(SheetImportApplication.class, args);
  }
}
