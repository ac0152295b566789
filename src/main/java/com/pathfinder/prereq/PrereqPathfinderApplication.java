package com.pathfinder.prereq;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PrereqPathfinderApplication {
    public static void main(String[] args) {
        SpringApplication.run(PrereqPathfinderApplication.class, args);
    }
}
