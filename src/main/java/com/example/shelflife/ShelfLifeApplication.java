package com.example.shelflife;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShelfLifeApplication {
  public static void main(String[] args) {
    SpringApplication.run(ShelfLifeApplication.class, args);
  }
}
