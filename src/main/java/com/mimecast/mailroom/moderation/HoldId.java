package com.mimecast.mailroom.moderation;

import org.apache.commons.codec.digest.DigestUtils;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Stable identifier of a hold record: list name and request id.
 * <p>The request id is derived from the Message-ID and a hold generation, so holding the same
 * message twice while pending yields the same identifier and holding it again after a resolution
 * yields the next one.
 * <p>String form is {@code <list>/<requestId>}.
 */
public final class HoldId {

    private static final Pattern REQUEST_ID = Pattern.compile("^[0-9a-f]{16}$");

    private final String listName;
    private final String requestId;

    public HoldId(String listName, String requestId) {
        if (listName == null || listName.isEmpty() || listName.contains("/")) {
            throw new IllegalArgumentException("Invalid list name: " + listName);
        }
        if (requestId == null || !REQUEST_ID.matcher(requestId).matches()) {
            throw new IllegalArgumentException("Invalid request id: " + requestId);
        }
        this.listName = listName.toLowerCase(Locale.ROOT);
        this.requestId = requestId;
    }

    /**
     * Derives the hold id of a message.
     *
     * @param listName  List name.
     * @param messageId Message-ID.
     * @return HoldId.
     */
    public static HoldId of(String listName, String messageId) {
        return of(listName, messageId, 0);
    }

    /**
     * Derives the hold id of a message for a hold generation.
     *
     * @param listName   List name.
     * @param messageId  Message-ID.
     * @param generation Zero for the first hold of the message.
     * @return HoldId.
     */
    public static HoldId of(String listName, String messageId, int generation) {
        String key = generation == 0 ? messageId.trim() : messageId.trim() + "#" + generation;
        return new HoldId(listName, DigestUtils.sha1Hex(key).substring(0, 16));
    }

    /**
     * Parses the string form.
     *
     * @param value {@code <list>/<requestId>}.
     * @return HoldId.
     * @throws IllegalArgumentException Malformed value.
     */
    public static HoldId parse(String value) {
        int slash = value == null ? -1 : value.lastIndexOf('/');
        if (slash <= 0) {
            throw new IllegalArgumentException("Invalid hold id: " + value);
        }
        return new HoldId(value.substring(0, slash), value.substring(slash + 1));
    }

    public String getListName() {
        return listName;
    }

    public String getRequestId() {
        return requestId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HoldId)) return false;
        HoldId holdId = (HoldId) o;
        return listName.equals(holdId.listName) && requestId.equals(holdId.requestId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(listName, requestId);
    }

    @Override
    public String toString() {
        return listName + "/" + requestId;
    }
}
