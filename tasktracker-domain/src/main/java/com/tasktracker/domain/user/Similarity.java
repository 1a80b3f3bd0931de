package com.tasktracker.domain.user;

import java.util.HashMap;
import java.util.Map;

final class Similarity {

    private Similarity() {}

    /**
     * Upper bound on the Ratcliff/Obershelp ratio: 2 * (shared characters, counted
     * with multiplicity) / (total characters). Returns 1.0 for two empty strings.
     */
    static double quickRatio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) return 1.0;

        Map<Character, Integer> available = new HashMap<>();
        for (int i = 0; i < b.length(); i++) {
            available.merge(b.charAt(i), 1, Integer::sum);
        }
        int matches = 0;
        for (int i = 0; i < a.length(); i++) {
            char c = a.charAt(i);
            Integer left = available.get(c);
            if (left != null && left > 0) {
                available.put(c, left - 1);
                matches++;
            }
        }
        return 2.0 * matches / total;
    }
}
