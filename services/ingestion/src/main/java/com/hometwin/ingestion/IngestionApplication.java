package com.hometwin.ingestion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Twin Ingestion Service
 *
 * Consumes Home Assistant sensor state batches from Kafka and applies each reading to the
 * sensor's digital twin.
 */
@SpringBootApplication
public class IngestionApplication {

    public static void main(String[] args) {
        SpringApplication.run(IngestionApplication.class, args);
    }
}
