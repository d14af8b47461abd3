package com.tableops.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when a required setting is missing or out of range.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String PLACEHOLDER_SECRET = "dev-jwt-secret-change-me-before-deploying-tableops";
    private static final long MIN_EXPIRATION_MS = 300_000L;
    private static final long MAX_EXPIRATION_MS = 86_400_000L;

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins",
            "server.port"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("configuration problem: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        if (PLACEHOLDER_SECRET.equals(environment.getProperty("jwt.secret"))) {
            log.warn("jwt.secret still uses the development placeholder; set JWT_SECRET before deploying");
        }
        log.info("environment validated");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();
        for (String key : REQUIRED_KEYS) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(key + " is missing");
            }
        }

        String secret = environment.getProperty("jwt.secret");
        if (secret != null && !secret.isBlank() && secret.length() < 32) {
            problems.add("jwt.secret must be at least 32 characters");
        }

        String expiration = environment.getProperty("jwt.expiration");
        if (expiration != null && !expiration.isBlank()) {
            try {
                long millis = Long.parseLong(expiration.trim());
                if (millis < MIN_EXPIRATION_MS || millis > MAX_EXPIRATION_MS) {
                    problems.add("jwt.expiration must be between " + MIN_EXPIRATION_MS + " and " + MAX_EXPIRATION_MS + " ms");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration must be numeric");
            }
        }
        return problems;
    }
}
