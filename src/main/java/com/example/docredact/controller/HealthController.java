package com.example.docredact.controller;

import com.example.docredact.engine.EngineGateway;
import com.example.docredact.kv.MetadataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness of the service and its session store. Sessions cannot be created or decrypted
 * without the store, so a store outage reports 503.
 */
@RestController
public class HealthController {

    private static final Logger logger = LoggerFactory.getLogger(HealthController.class);
    private static final String PROBE_KEY = "health-check";

    private final MetadataStore metadataStore;
    private final EngineGateway engineGateway;

    public HealthController(MetadataStore metadataStore, EngineGateway engineGateway) {
        this.metadataStore = metadataStore;
        this.engineGateway = engineGateway;
    }

    @GetMapping({"/health", "/actuator/health"})
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("service", "doc-redact");
        health.put("version", "0.1.0");
        health.put("engines", engineGateway.variants());

        boolean storeUp;
        try {
            metadataStore.get(PROBE_KEY);
            storeUp = true;
            health.put("redis", "UP");
        } catch (RuntimeException e) {
            logger.warn("Health probe could not reach the session store: {}", e.getMessage());
            storeUp = false;
            health.put("redis", "DOWN");
            health.put("redisError", e.getMessage());
        }
        health.put("status", storeUp ? "UP" : "DOWN");

        return ResponseEntity.status(storeUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(health);
    }
}
