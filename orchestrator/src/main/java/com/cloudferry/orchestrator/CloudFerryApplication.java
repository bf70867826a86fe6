package com.cloudferry.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Job lifecycle orchestrator.
 *
 * To run locally:
 *   DB_URL=jdbc:postgresql://localhost:5432/cloudferry REDIS_HOST=localhost mvn spring-boot:run
 */
@SpringBootApplication
@EnableScheduling
public class CloudFerryApplication {

    public static void main(String[] args) {
        SpringApplication.run(CloudFerryApplication.class, args);
    }
}
