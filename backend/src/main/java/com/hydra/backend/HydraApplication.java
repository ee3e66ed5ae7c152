package com.hydra.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class HydraApplication {

    public static void main(String[] args) {
        SpringApplication.run(HydraApplication.class, args);
    }
}
