package org.neuralchilli.juglans.util;

import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * String helpers exposed to expressions as {@code string.*} and used by the chat adapter.
 */
public class StringFunctions {

    private static final Pattern SLUG_PATTERN = Pattern.compile("[^a-z0-9-]+");
    private static final Pattern CODE_FENCE = Pattern.compile("^```[a-zA-Z0-9_-]*\\s*\\n?(.*?)\\n?```\\s*$", Pattern.DOTALL);

    /**
     * Generate a random UUID
     */
    public String uuid() {
        return UUID.randomUUID().toString();
    }

    /**
     * Convert a string to a URL-safe slug
     * Example: "Customer Support Agent" -> "customer-support-agent"
     */
    public String slugify(String input) {
        if (input == null || input.isBlank()) {
            return "";
        }

        String slug = input.toLowerCase()
                .trim()
                .replaceAll("\\s+", "-");

        slug = SLUG_PATTERN.matcher(slug).replaceAll("");
        slug = slug.replaceAll("-+", "-");
        return slug.replaceAll("^-|-$", "");
    }

    /**
     * Cut a string to at most {@code max} characters, marking the cut with an ellipsis
     */
    public String truncate(String input, int max) {
        if (input == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        if (input.length() <= max) {
            return input;
        }
        if (max <= 3) {
            return input.substring(0, max);
        }
        return input.substring(0, max - 3) + "...";
    }

    /**
     * Remove a surrounding markdown code fence, as models often wrap JSON answers in one
     */
    public String stripCodeFences(String input) {
        if (input == null) {
            return "";
        }
        String trimmed = input.trim();
        Matcher matcher = CODE_FENCE.matcher(trimmed);
        if (matcher.matches()) {
            return matcher.group(1).trim();
        }
        return trimmed;
    }

    /**
     * Check whether {@code input} is null, empty or only whitespace
     */
    public boolean isBlank(String input) {
        return input == null || input.isBlank();
    }
}
