package com.bikeredlights.ride;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RideEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RideEngineApplication.class, args);
    }
}
