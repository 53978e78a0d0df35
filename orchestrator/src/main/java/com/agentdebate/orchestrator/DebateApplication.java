package com.agentdebate.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Multi-agent debate service.
 *
 * To run (needs the claude and/or gemini CLIs on PATH):
 *   mvn spring-boot:run
 */
@SpringBootApplication
public class DebateApplication {

    public static void main(String[] args) {
        SpringApplication.run(DebateApplication.class, args);
    }
}
