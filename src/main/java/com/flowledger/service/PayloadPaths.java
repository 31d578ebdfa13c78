package com.flowledger.service;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Resolves dotted field paths like "address.city" or "items.0.sku" against a
 * JSON payload. A leading "payload." is stripped since we're already given
 * the payload.
 */
final class PayloadPaths {

    private static final String PAYLOAD_PREFIX = "payload.";

    private PayloadPaths() {
    }

    /**
     * Returns the value at {@code fieldPath}, or null when any segment is
     * missing. Never throws.
     */
    static JsonNode resolve(JsonNode root, String fieldPath) {
        if (root == null || fieldPath == null || fieldPath.isBlank()) {
            return null;
        }
        String path = fieldPath.trim();
        if (path.startsWith(PAYLOAD_PREFIX)) {
            path = path.substring(PAYLOAD_PREFIX.length());
        }

        JsonNode current = root;
        for (String segment : path.split("\\.", -1)) {
            if (segment.isEmpty() || current == null) {
                return null;
            }
            if (current.isObject()) {
                current = current.get(segment);
            } else if (current.isArray() && isIndex(segment)) {
                current = current.get(Integer.parseInt(segment));
            } else {
                return null;
            }
        }
        return current == null || current.isMissingNode() ? null : current;
    }

    private static boolean isIndex(String segment) {
        if (segment.length() > 9) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
