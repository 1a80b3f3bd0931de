package com.tasktracker.api.health;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

@RestController
public class HealthController {
    @GetMapping({"/api/health", "/api/health/"})
    public Map<String, Object> health() {
        return Map.of(
                "status", "ok",
                "service", "tasktracker-api",
                "ts", Instant.now().toString()
        );
    }
}
