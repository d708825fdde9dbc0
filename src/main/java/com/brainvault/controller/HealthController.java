package com.brainvault.controller;

import com.brainvault.dto.response.HealthResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Public liveness endpoints outside the /api/v1 prefix.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private static final int DB_CHECK_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;

    @Value("${app.version:1.0.0}")
    private String version;

    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("message", "AI Brain Vault API");
        body.put("version", version);
        body.put("status", "running");
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("healthy", databaseStatus()));
    }

    private String databaseStatus() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(DB_CHECK_TIMEOUT_SECONDS) ? "connected" : "disconnected";
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return "disconnected";
        }
    }
}
