package com.tasktracker.api.security;

import java.util.UUID;

/**
 * The verified identity behind the current request.
 */
public record Caller(UUID userId, String username, String role) {}
