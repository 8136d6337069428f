package io.livedoc.security;

import java.util.regex.Pattern;

/**
 * Validation of identifiers and free text arriving over HTTP and the socket.
 *
 * Rules:
 * - Resource ids: start with a letter or digit, then letters, digits, '_', '.', ':' or '-'; 128 chars max
 * - Form text: trimmed, control characters removed, at most 1000 chars
 *
 * Usage:
 * <pre>
 * InputValidator validator = new InputValidator();
 * validator.validateResourceId("cart-42");   // Throws if invalid
 * String clean = validator.sanitize(formValue);
 * </pre>
 */
public class InputValidator {

    private static final Pattern RESOURCE_ID_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.:-]{0,127}$");
    private static final Pattern FIELD_NAME_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]{0,63}$");

    private static final int MAX_STRING_LENGTH = 1000;

    /**
     * @param resourceId candidate id
     * @return true if it can be used as a document key and a subscription key
     */
    public boolean isValidResourceId(String resourceId) {
        return resourceId != null && RESOURCE_ID_PATTERN.matcher(resourceId).matches();
    }

    /**
     * @throws IllegalArgumentException if invalid
     */
    public void validateResourceId(String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("Resource id cannot be null or empty");
        }
        if (!isValidResourceId(resourceId)) {
            throw new IllegalArgumentException("Invalid resource id: " + abbreviate(resourceId));
        }
    }

    /**
     * Form field names become JSON keys; keep them identifier-like.
     */
    public boolean isValidFieldName(String name) {
        return name != null && FIELD_NAME_PATTERN.matcher(name).matches();
    }

    /**
     * Sanitize string input.
     *
     * - Trims whitespace
     * - Removes control characters (except newline and tab)
     * - Limits length to MAX_STRING_LENGTH
     */
    public String sanitize(String input) {
        if (input == null) {
            return null;
        }

        String result = input.trim();
        result = result.replaceAll("[\\p{Cntrl}&&[^\n\t]]", "");

        if (result.length() > MAX_STRING_LENGTH) {
            result = result.substring(0, MAX_STRING_LENGTH);
        }
        return result;
    }

    private static String abbreviate(String value) {
        return value.length() > 40 ? value.substring(0, 40) + "..." : value;
    }
}
