package com.ridehub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RideHubApplication {
    public static void main(String[] args) {
        SpringApplication.run(RideHubApplication.class, args);
    }
}
