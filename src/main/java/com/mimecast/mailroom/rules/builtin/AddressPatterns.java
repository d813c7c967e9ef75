package com.mimecast.mailroom.rules.builtin;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Matches addresses against list configured patterns.
 * <p>A pattern starting with {@code ^} is a case insensitive regular expression,
 * anything else is compared as a literal address.
 */
final class AddressPatterns {
    private static final Logger log = LogManager.getLogger(AddressPatterns.class);

    private AddressPatterns() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Finds the first pattern matching an address.
     *
     * @param address  Email address.
     * @param patterns Addresses or ^regexes.
     * @return Matching pattern or null.
     */
    static String firstMatch(String address, List<String> patterns) {
        if (address == null) {
            return null;
        }
        String lowered = address.toLowerCase(Locale.ROOT);
        for (String pattern : patterns) {
            if (pattern.startsWith("^")) {
                try {
                    if (Pattern.compile(pattern, Pattern.CASE_INSENSITIVE).matcher(lowered).find()) {
                        return pattern;
                    }
                } catch (PatternSyntaxException e) {
                    log.warn("Ignoring invalid address pattern {}: {}", pattern, e.getDescription());
                }
            } else if (pattern.equalsIgnoreCase(lowered)) {
                return pattern;
            }
        }
        return null;
    }

    static boolean matches(String address, List<String> patterns) {
        return firstMatch(address, patterns) != null;
    }
}
