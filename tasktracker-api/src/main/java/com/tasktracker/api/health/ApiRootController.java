package com.tasktracker.api.health;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point listing the main routes, for humans poking at the API.
 */
@RestController
public class ApiRootController {

    @GetMapping({"/api", "/api/"})
    public Map<String, Object> root() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("tasks", "/api/tasks");
        endpoints.put("auth_register", "/api/auth/register");
        endpoints.put("auth_login", "/api/token");
        endpoints.put("auth_refresh", "/api/token/refresh");
        endpoints.put("auth_me", "/api/auth/me");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Task Manager API");
        body.put("endpoints", endpoints);
        return body;
    }
}
