package com.fry.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PainEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PainEngineApplication.class, args);
    }
}
