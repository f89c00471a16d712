package com.whereq.orchestra;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Orchestra.
 * This service queues playbook generation, validation, lint, execution and refinement jobs,
 * runs them on per-type worker pools and streams their progress to WebSocket subscribers.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class OrchestraApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestraApplication.class, args);
    }
}
