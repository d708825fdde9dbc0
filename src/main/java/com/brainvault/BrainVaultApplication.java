package com.brainvault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the Brain Vault backend.
 *
 * This Spring Boot application provides a REST API for capturing and transforming ideas,
 * featuring:
 * - Owner-scoped idea storage in PostgreSQL with full-text search
 * - Asynchronous idea enrichment (project, theme, emotion) via RabbitMQ
 * - AI transformations through Spring AI chat models with a local fallback
 * - Voice capture with Whisper transcription
 * - Bearer JWT authentication
 */
@SpringBootApplication
public class BrainVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(BrainVaultApplication.class, args);
    }
}
