package com.docflow.workflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Document approval workflow service.
 *
 * To run against a local Postgres:
 *   DB_URL=jdbc:postgresql://localhost:5432/docflow DB_USER=docflow DB_PASSWORD=docflow mvn spring-boot:run
 */
@SpringBootApplication
public class DocflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocflowApplication.class, args);
    }
}
