package com.basisengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BasisEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(BasisEngineApplication.class, args);
    }
}
