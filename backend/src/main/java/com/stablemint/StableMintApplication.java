package com.stablemint;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class StableMintApplication {

    public static void main(String[] args) {
        SpringApplication.run(StableMintApplication.class, args);
    }
}
