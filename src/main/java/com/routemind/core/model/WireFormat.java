package com.routemind.core.model;

/**
 * Request/response format a backend speaks.
 */
public enum WireFormat {
    OPENAI_COMPATIBLE("openai-compatible"),
    REST("rest"),
    CUSTOM("custom");

    private final String tag;

    WireFormat(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Parses a configuration tag. Accepts {@code "openai"} as shorthand for
     * {@code "openai-compatible"}.
     *
     * @throws IllegalArgumentException for blank or unknown tags
     */
    public static WireFormat fromTag(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Wire format must not be blank");
        }
        String normalized = value.trim();
        if ("openai".equalsIgnoreCase(normalized)) {
            return OPENAI_COMPATIBLE;
        }
        for (var format : values()) {
            if (format.tag.equalsIgnoreCase(normalized) || format.name().equalsIgnoreCase(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown wire format: " + value
                + " (expected openai-compatible, rest or custom)");
    }
}
