package com.scholary.avatar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AvatarGeneratorApplication {

  public static void main(String[] args) {
    SpringApplication.run(AvatarGeneratorApplication.class, args);
  }
}
