package com.tasktracker.api.auth;

import com.tasktracker.domain.user.PasswordPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Password strength settings.
 */
@ConfigurationProperties(prefix = "tasktracker.password")
public record PasswordPolicyProperties(

    @DefaultValue("" + PasswordPolicy.DEFAULT_MIN_LENGTH)
    int minLength,

    /**
     * Similarity ratio (0..1) at or above which a password counts as too close
     * to the username, names or email.
     */
    @DefaultValue("" + PasswordPolicy.DEFAULT_MAX_SIMILARITY)
    double maxSimilarity,

    /**
     * Resource location of the common password list, one per line, optionally gzip-compressed.
     */
    @DefaultValue("classpath:common-passwords.txt.gz")
    String commonPasswords

) {}
