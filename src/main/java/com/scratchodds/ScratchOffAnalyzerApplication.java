package com.scratchodds;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application for the scratch-off odds analyzer.
 */
@SpringBootApplication
public class ScratchOffAnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScratchOffAnalyzerApplication.class, args);
    }
}
