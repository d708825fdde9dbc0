package com.brainvault.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.List;

/**
 * CORS configuration for browser clients of the ideas API.
 *
 * Origins, methods and headers come from app.cors.* so each environment can list its own
 * front ends. The source is picked up by SecurityConfig through {@code cors(withDefaults())},
 * which keeps preflight requests ahead of authentication.
 *
 * Example:
 * <pre>
 * app:
 *   cors:
 *     allowed-origins: https://app.brainvault.app,http://localhost:3000
 * </pre>
 */
@Configuration
@Slf4j
public class CorsConfig {

    static final List<String> API_PATHS = List.of("/api/**", "/health");

    @Value("${app.cors.allowed-origins:http://localhost:3000}")
    private List<String> allowedOrigins;

    @Value("${app.cors.allowed-methods:GET,POST,PUT,DELETE,OPTIONS}")
    private List<String> allowedMethods;

    @Value("${app.cors.allowed-headers:Authorization,Content-Type,Accept,Origin}")
    private List<String> allowedHeaders;

    @Value("${app.cors.max-age:3600}")
    private long maxAge;

    /**
     * Origins may be exact ({@code https://app.brainvault.app}) or patterns
     * ({@code https://*.brainvault.app}). Credentials are never allowed because callers
     * authenticate with a bearer header, not cookies.
     */
    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration api = new CorsConfiguration();
        api.setAllowedOriginPatterns(allowedOrigins);
        api.setAllowedMethods(allowedMethods);
        api.setAllowedHeaders(allowedHeaders);
        api.setExposedHeaders(List.of(HttpHeaders.LOCATION));
        api.setAllowCredentials(false);
        api.setMaxAge(maxAge);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        API_PATHS.forEach(path -> source.registerCorsConfiguration(path, api));

        log.info("CORS enabled for {} from origins {}", API_PATHS, allowedOrigins);
        return source;
    }
}
