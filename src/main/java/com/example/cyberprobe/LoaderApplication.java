package com.example.cyberprobe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LoaderApplication {

  public static void main(String[] args) {
    SpringApplication.run(LoaderApplication.class, args);
  }
}
