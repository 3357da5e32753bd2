package com.patentflow.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Task orchestration engine for the patent-drafting pipeline.
 *
 * To run locally:
 *   PATENTFLOW_COMPUTE_URL=http://compute:8000 DB_URL=jdbc:postgresql://localhost:5432/patentflow mvn spring-boot:run
 */
@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
