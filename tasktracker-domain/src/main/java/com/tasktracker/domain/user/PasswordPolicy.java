package com.tasktracker.domain.user;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Strength rules applied to a new password.
 *
 * Rules (every one is evaluated, all messages are returned):
 * - minimum length
 * - not entirely numeric
 * - not in the common password list (case-insensitive)
 * - not too similar to the user's own attributes (username, names, email)
 */
public final class PasswordPolicy {

    public static final int DEFAULT_MIN_LENGTH = 8;
    public static final double DEFAULT_MAX_SIMILARITY = 0.7;

    private final int minLength;
    private final double maxSimilarity;
    private final Set<String> commonPasswords;

    public PasswordPolicy(int minLength, double maxSimilarity, Set<String> commonPasswords) {
        if (minLength < 1) throw new IllegalArgumentException("minLength must be >= 1");
        if (maxSimilarity < 0.1) throw new IllegalArgumentException("maxSimilarity must be >= 0.1");
        this.minLength = minLength;
        this.maxSimilarity = maxSimilarity;
        this.commonPasswords = Objects.requireNonNull(commonPasswords, "commonPasswords").stream()
                .map(p -> p.trim().toLowerCase(Locale.ROOT))
                .filter(p -> !p.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * @return violation messages, empty when the password is acceptable
     */
    public List<String> check(String password, UserAttributes user) {
        List<String> problems = new ArrayList<>();
        String pw = password == null ? "" : password;

        if (pw.length() < minLength) {
            problems.add("This password is too short. It must contain at least "
                    + minLength + (minLength == 1 ? " character." : " characters."));
        }
        if (!pw.isEmpty() && pw.chars().allMatch(Character::isDigit)) {
            problems.add("This password is entirely numeric.");
        }
        if (commonPasswords.contains(pw.trim().toLowerCase(Locale.ROOT))) {
            problems.add("This password is too common.");
        }
        String similarTo = similarAttribute(pw, user);
        if (similarTo != null) {
            problems.add("The password is too similar to the " + similarTo + ".");
        }
        return problems;
    }

    private String similarAttribute(String password, UserAttributes user) {
        if (user == null || password.isEmpty()) return null;
        String pw = password.toLowerCase(Locale.ROOT);

        for (Map.Entry<String, String> attr : user.asVerboseMap().entrySet()) {
            String value = attr.getValue();
            if (value == null || value.isBlank()) continue;

            String lower = value.toLowerCase(Locale.ROOT);
            List<String> parts = new ArrayList<>(List.of(lower.split("\\W+")));
            parts.add(lower);

            for (String part : parts) {
                if (part.isEmpty() || exceedsLengthRatio(pw, part)) continue;
                if (Similarity.quickRatio(pw, part) >= maxSimilarity) {
                    return attr.getKey();
                }
            }
        }
        return null;
    }

    // A password far longer than the attribute cannot be "too similar" to it.
    private boolean exceedsLengthRatio(String password, String value) {
        int pwdLen = password.length();
        double lengthBound = maxSimilarity / 2 * pwdLen;
        int valueLen = value.length();
        return pwdLen >= 10 * valueLen && valueLen < lengthBound;
    }

    public int minLength() {
        return minLength;
    }

    public double maxSimilarity() {
        return maxSimilarity;
    }

    /**
     * Reads one password per line; blank lines and lines starting with '#' are skipped.
     */
    public static Set<String> readCommonPasswords(InputStream in) throws IOException {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return reader.lines()
                    .map(String::trim)
                    .filter(l -> !l.isEmpty() && !l.startsWith("#"))
                    .collect(Collectors.toUnmodifiableSet());
        }
    }

    /**
     * User fields the similarity rule compares against.
     */
    public record UserAttributes(String username, String firstName, String lastName, String email) {

        Map<String, String> asVerboseMap() {
            Map<String, String> out = new LinkedHashMap<>();
            out.put("username", username);
            out.put("first name", firstName);
            out.put("last name", lastName);
            out.put("email address", email);
            return out;
        }
    }
}
