package com.bbthechange.eventapi.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness endpoints used by the API gateway and load balancer.
 * Store connectivity is reported separately by the actuator health endpoint.
 */
@RestController
public class HealthController {
    
    @GetMapping("/")
    public Map<String, String> home() {
        return Map.of("message", "Event Management API");
    }
    
    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy");
    }
}
