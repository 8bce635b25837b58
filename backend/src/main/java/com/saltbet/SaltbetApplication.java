package com.saltbet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SaltbetApplication {
    public static void main(String[] args) {
        SpringApplication.run(SaltbetApplication.class, args);
    }
}
