package com.mimecast.mailroom.queue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Message metadata.
 *
 * <p>Sidecar record travelling with a message between queues. It is the only place where
 * processing progress is recorded: target list, rule hits, retry count, handler completion
 * markers and the decision log.
 * <p>Values are booleans, strings, numbers, lists and nested maps so they survive the
 * queue record encoding unchanged.
 */
@SuppressWarnings("unchecked")
public class Metadata {

    public static final String LISTNAME = "listname";
    public static final String RECEIVED_TIME = "receivedTime";
    public static final String RETRY_COUNT = "retryCount";
    public static final String STORAGE_FAILURES = "storageFailures";
    public static final String NOT_BEFORE = "notBefore";
    public static final String LAST_ERROR = "lastError";
    public static final String RULE_HITS = "ruleHits";
    public static final String RULE_MISSES = "ruleMisses";
    public static final String ANNOTATIONS = "annotations";
    public static final String DECISIONS = "decisions";
    public static final String COMPLETED = "completed";
    public static final String VERDICT = "verdict";
    public static final String BYPASS_RULES = "bypassRules";
    public static final String MODERATOR_APPROVED = "moderatorApproved";
    public static final String RECIPIENTS = "recipients";
    public static final String HOLD_ID = "holdId";
    public static final String NOTICE = "notice";
    public static final String NOTICE_TYPE = "noticeType";
    public static final String NOTICE_REASON = "noticeReason";
    public static final String ORIGINAL_SENDER = "originalSender";
    public static final String ENVELOPE_SENDER = "envelopeSender";
    public static final String FAILED_RECIPIENTS = "failedRecipients";
    public static final String TO_OWNER = "toOwner";
    public static final String MODERATION_ACTION = "moderationAction";
    public static final String MODERATION_REASON = "moderationReason";
    public static final String SHUNTED_FROM = "shuntedFrom";

    private final Map<String, Object> map;

    /**
     * Constructs a new empty instance.
     */
    public Metadata() {
        this.map = new LinkedHashMap<>();
    }

    /**
     * Constructs a new instance from a decoded map.
     *
     * @param map Map instance, taken by reference.
     */
    public Metadata(Map<String, Object> map) {
        this.map = map != null ? map : new LinkedHashMap<>();
    }

    /**
     * Convenience constructor for a list bound message.
     *
     * @param listName List name.
     * @return Metadata instance.
     */
    public static Metadata forList(String listName) {
        return new Metadata().put(LISTNAME, listName);
    }

    /**
     * Gets backing map.
     *
     * @return Map instance.
     */
    public Map<String, Object> asMap() {
        return map;
    }

    public Metadata put(String key, Object value) {
        map.put(key, value);
        return this;
    }

    public Object get(String key) {
        return map.get(key);
    }

    public boolean containsKey(String key) {
        return map.containsKey(key);
    }

    public Metadata remove(String key) {
        map.remove(key);
        return this;
    }

    public String getString(String key) {
        Object value = map.get(key);
        return value != null ? String.valueOf(value) : null;
    }

    public long getLong(String key, long defaultValue) {
        Object value = map.get(key);
        return value instanceof Number ? ((Number) value).longValue() : defaultValue;
    }

    public boolean getBoolean(String key) {
        Object value = map.get(key);
        return value instanceof Boolean && (Boolean) value;
    }

    /**
     * Gets a list of strings.
     *
     * @param key Key.
     * @return Unmodifiable list, never null.
     */
    public List<String> getStringList(String key) {
        Object value = map.get(key);
        if (!(value instanceof List)) {
            return Collections.emptyList();
        }
        List<String> list = new ArrayList<>();
        for (Object item : (List<Object>) value) {
            list.add(String.valueOf(item));
        }
        return Collections.unmodifiableList(list);
    }

    /**
     * Adds a string to a list value unless already present.
     *
     * @param key   Key.
     * @param value Value.
     * @return Self.
     */
    public Metadata addToList(String key, String value) {
        Object current = map.get(key);
        List<Object> list;
        if (current instanceof List) {
            list = (List<Object>) current;
        } else {
            list = new ArrayList<>();
            map.put(key, list);
        }
        if (!list.contains(value)) {
            list.add(value);
        }
        return this;
    }

    /**
     * Gets a nested map, creating it when absent.
     *
     * @param key Key.
     * @return Mutable map.
     */
    public Map<String, Object> getOrCreateMap(String key) {
        Object current = map.get(key);
        if (current instanceof Map) {
            return (Map<String, Object>) current;
        }
        Map<String, Object> created = new LinkedHashMap<>();
        map.put(key, created);
        return created;
    }

    public String getListName() {
        return getString(LISTNAME);
    }

    public int getRetryCount() {
        return (int) getLong(RETRY_COUNT, 0L);
    }

    /**
     * Increments the retry counter.
     *
     * @return New value.
     */
    public int incrementRetryCount() {
        int count = getRetryCount() + 1;
        map.put(RETRY_COUNT, (long) count);
        return count;
    }

    public int getStorageFailures() {
        return (int) getLong(STORAGE_FAILURES, 0L);
    }

    /**
     * Records a rule annotation explaining a hit.
     *
     * @param rule Rule name.
     * @param note Annotation.
     * @return Self.
     */
    public Metadata annotate(String rule, String note) {
        getOrCreateMap(ANNOTATIONS).put(rule, note);
        return this;
    }

    /**
     * Gets the annotation written by a rule.
     *
     * @param rule Rule name.
     * @return Annotation or null.
     */
    public String getAnnotation(String rule) {
        Object value = getOrCreateMap(ANNOTATIONS).get(rule);
        return value != null ? String.valueOf(value) : null;
    }

    /**
     * Checks a per-handler completion marker.
     *
     * @param handler Handler name.
     * @return Boolean.
     */
    public boolean isCompleted(String handler) {
        return getStringList(COMPLETED).contains(handler);
    }

    /**
     * Sets a per-handler completion marker.
     *
     * @param handler Handler name.
     * @return Self.
     */
    public Metadata markCompleted(String handler) {
        return addToList(COMPLETED, handler);
    }

    /**
     * Appends to the decision log.
     *
     * @param stage   Component making the decision (runner, chain or handler name).
     * @param outcome Outcome.
     * @param detail  Free text detail, may be null.
     * @param at      Time of the decision.
     * @return Self.
     */
    public Metadata recordDecision(String stage, String outcome, String detail, Instant at) {
        Object current = map.get(DECISIONS);
        List<Object> log;
        if (current instanceof List) {
            log = (List<Object>) current;
        } else {
            log = new ArrayList<>();
            map.put(DECISIONS, log);
        }
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("stage", stage);
        entry.put("outcome", outcome);
        if (detail != null) {
            entry.put("detail", detail);
        }
        entry.put("at", at.toEpochMilli());
        log.add(entry);
        return this;
    }

    /**
     * Gets the decision log.
     *
     * @return List of decision maps.
     */
    public List<Map<String, Object>> getDecisions() {
        Object current = map.get(DECISIONS);
        if (!(current instanceof List)) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> decisions = new ArrayList<>();
        for (Object item : (List<Object>) current) {
            if (item instanceof Map) {
                decisions.add((Map<String, Object>) item);
            }
        }
        return decisions;
    }

    /**
     * Deep copy.
     *
     * @return New Metadata instance.
     */
    public Metadata copy() {
        return new Metadata((Map<String, Object>) deepCopy(map));
    }

    private static Object deepCopy(Object value) {
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) value).entrySet()) {
                copy.put(entry.getKey(), deepCopy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        return value;
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
