package com.mimecast.mailroom.rules;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a rule chain evaluation.
 */
public final class Verdict {

    /**
     * Verdict types.
     */
    public enum Type {
        ACCEPT, HOLD, DISCARD, REJECT
    }

    private static final Verdict ACCEPTED = new Verdict(Type.ACCEPT, null, null);

    private final Type type;
    private final String reason;
    private final String rule;

    private Verdict(Type type, String reason, String rule) {
        this.type = type;
        this.reason = reason;
        this.rule = rule;
    }

    public static Verdict accept() {
        return ACCEPTED;
    }

    /**
     * Accept verdict produced by an accepting rule.
     *
     * @param rule Rule name.
     * @return Verdict.
     */
    public static Verdict accept(String rule) {
        return rule == null ? ACCEPTED : new Verdict(Type.ACCEPT, null, rule);
    }

    public static Verdict hold(String reason, String rule) {
        return new Verdict(Type.HOLD, reason, rule);
    }

    public static Verdict discard(String rule) {
        return new Verdict(Type.DISCARD, null, rule);
    }

    public static Verdict reject(String reason, String rule) {
        return new Verdict(Type.REJECT, reason, rule);
    }

    public Type getType() {
        return type;
    }

    public String getReason() {
        return reason;
    }

    public String getRule() {
        return rule;
    }

    public boolean isAccept() {
        return type == Type.ACCEPT;
    }

    /**
     * Converts to a map for storage in metadata.
     *
     * @return Map.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type.name().toLowerCase(Locale.ROOT));
        if (reason != null) {
            map.put("reason", reason);
        }
        if (rule != null) {
            map.put("rule", rule);
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Verdict)) return false;
        Verdict verdict = (Verdict) o;
        return type == verdict.type && Objects.equals(reason, verdict.reason) && Objects.equals(rule, verdict.rule);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, reason, rule);
    }

    @Override
    public String toString() {
        return "Verdict{" + type.name().toLowerCase(Locale.ROOT)
                + (rule != null ? ", rule=" + rule : "")
                + (reason != null ? ", reason=" + reason : "") + "}";
    }
}
