package com.example.cortex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CortexMemoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(CortexMemoryApplication.class, args);
    }
}
