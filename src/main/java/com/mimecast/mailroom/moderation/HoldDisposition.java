package com.mimecast.mailroom.moderation;

import java.util.Locale;

/**
 * Disposition of a hold record.
 * <p>Only {@link #PENDING} is mutable.
 */
public enum HoldDisposition {
    PENDING,
    APPROVED,
    REJECTED,
    DISCARDED;

    /**
     * Parses a disposition name, accepting the verbs {@code approve}, {@code reject} and {@code discard}.
     *
     * @param value Name.
     * @return HoldDisposition.
     * @throws IllegalArgumentException Unknown disposition.
     */
    public static HoldDisposition fromString(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "pending":
                return PENDING;
            case "approve":
            case "approved":
            case "accept":
                return APPROVED;
            case "reject":
            case "rejected":
                return REJECTED;
            case "discard":
            case "discarded":
                return DISCARDED;
            default:
                throw new IllegalArgumentException("Unknown disposition: " + value);
        }
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
