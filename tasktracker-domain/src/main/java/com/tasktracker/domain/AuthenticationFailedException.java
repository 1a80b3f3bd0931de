package com.tasktracker.domain;

/**
 * Credentials or tokens that do not prove an active identity.
 *
 * The message is safe to return to the client; it never says which part of the
 * credentials was wrong.
 */
public final class AuthenticationFailedException extends DomainException {

    public static final String BAD_CREDENTIALS = "No active account found with the given credentials";
    public static final String INVALID_TOKEN = "Token is invalid or expired";

    private final String reason;

    private AuthenticationFailedException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static AuthenticationFailedException badCredentials() {
        return new AuthenticationFailedException("authentication_failed", BAD_CREDENTIALS);
    }

    public static AuthenticationFailedException invalidToken() {
        return new AuthenticationFailedException("token_not_valid", INVALID_TOKEN);
    }

    public String reason() {
        return reason;
    }
}
