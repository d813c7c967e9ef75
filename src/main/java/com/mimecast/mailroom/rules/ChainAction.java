package com.mimecast.mailroom.rules;

import java.util.Locale;

/**
 * Action applied when a chain link's rule hits.
 */
public enum ChainAction {

    /**
     * Stop and hold for moderator review.
     */
    HOLD,

    /**
     * Stop and drop silently.
     */
    DISCARD,

    /**
     * Stop and bounce a rejection notice to the sender.
     */
    REJECT,

    /**
     * Keep evaluating; the hit only leaves an annotation.
     */
    DEFER,

    /**
     * Stop and accept immediately.
     */
    ACCEPT,

    /**
     * Stop and apply the action the rule itself determined from list moderation settings.
     */
    MODERATION;

    /**
     * Parses an action name.
     * <p>Accepts the enum names case insensitively plus {@code defer-to-next} and {@code accept-immediately}.
     *
     * @param value Action name.
     * @return ChainAction.
     * @throws IllegalArgumentException Unknown action.
     */
    public static ChainAction fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Chain action missing");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "defer-to-next":
                return DEFER;
            case "accept-immediately":
                return ACCEPT;
            default:
                try {
                    return valueOf(normalized.toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Unknown chain action: " + value, e);
                }
        }
    }

    /**
     * Is this a terminal action.
     *
     * @return Boolean.
     */
    public boolean isTerminal() {
        return this != DEFER;
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
