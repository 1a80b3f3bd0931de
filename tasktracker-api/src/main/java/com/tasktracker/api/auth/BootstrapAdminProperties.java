package com.tasktracker.api.auth;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Optional administrator account created at startup.
 *
 * Values are expected from the environment (ADMIN_USERNAME / ADMIN_EMAIL / ADMIN_PASSWORD).
 */
@ConfigurationProperties(prefix = "tasktracker.bootstrap-admin")
public record BootstrapAdminProperties(
    boolean enabled,
    String username,
    String email,
    String password
) {}
