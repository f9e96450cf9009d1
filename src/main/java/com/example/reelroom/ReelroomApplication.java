package com.example.reelroom;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ReelroomApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReelroomApplication.class, args);
    }
}
