package com.venuevibe.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class VenueOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(VenueOrchestratorApplication.class, args);
    }
}
