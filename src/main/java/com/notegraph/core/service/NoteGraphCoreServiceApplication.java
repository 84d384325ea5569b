package com.notegraph.core.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.neo4j.Neo4jAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * NoteGraph Core Service - Entry point for the Spring Boot application.
 *
 * Indexes a personal vault of markdown notes into a relationship graph and a retrieval
 * index, answers hybrid searches over them and persists both as debounced snapshots.
 * The Neo4j driver is created by {@code GraphStorageConfig} only when the Neo4j backend is selected.
 */
@SpringBootApplication(exclude = Neo4jAutoConfiguration.class)
@EnableAsync
@ConfigurationPropertiesScan("com.notegraph.core.service.config")
public class NoteGraphCoreServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(NoteGraphCoreServiceApplication.class, args);
    }
}
