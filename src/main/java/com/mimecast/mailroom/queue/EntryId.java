package com.mimecast.mailroom.queue;

import org.apache.commons.codec.digest.DigestUtils;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Queue entry identifier.
 *
 * <p>Rendered as {@code <when>+<listDigest>+<unique>}:
 * <ul>
 *     <li>{@code when} - 13 digit epoch milliseconds; receipt time or not-before time. Sorts FIFO.</li>
 *     <li>{@code listDigest} - SHA-1 hex of the list name; the shard key.</li>
 *     <li>{@code unique} - 16 random hex digits.</li>
 * </ul>
 * <p>The {@link #key()} (digest and unique part) stays stable when an entry is re-homed with a
 * new {@code when}.
 */
public final class EntryId implements Comparable<EntryId> {

    private static final Pattern PATTERN = Pattern.compile("^(\\d{13})\\+([0-9a-f]{40})\\+([0-9a-f]{16})$");
    private static final SecureRandom RANDOM = new SecureRandom();

    private final long when;
    private final String listDigest;
    private final String unique;

    private EntryId(long when, String listDigest, String unique) {
        this.when = when;
        this.listDigest = listDigest;
        this.unique = unique;
    }

    /**
     * Creates a fresh identifier.
     *
     * @param listName List name, may be null for list-less entries.
     * @param when     Epoch milliseconds.
     * @return EntryId instance.
     */
    public static EntryId create(String listName, long when) {
        return new EntryId(when, digest(listName), String.format("%016x", RANDOM.nextLong()));
    }

    /**
     * Computes the shard key digest for a list name.
     *
     * @param listName List name.
     * @return 40 hex digits.
     */
    public static String digest(String listName) {
        String name = listName != null ? listName.toLowerCase(Locale.ROOT) : "--nolist--";
        return DigestUtils.sha1Hex(name);
    }

    /**
     * Parses a rendered identifier.
     *
     * @param value String.
     * @return EntryId instance.
     * @throws IllegalArgumentException If malformed.
     */
    public static EntryId parse(String value) {
        Matcher matcher = PATTERN.matcher(value);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Malformed entry id: " + value);
        }
        return new EntryId(Long.parseLong(matcher.group(1)), matcher.group(2), matcher.group(3));
    }

    /**
     * Checks if a string is a well formed identifier.
     *
     * @param value String.
     * @return Boolean.
     */
    public static boolean isValid(String value) {
        return value != null && PATTERN.matcher(value).matches();
    }

    /**
     * Returns a copy with a different ordering time.
     *
     * @param newWhen Epoch milliseconds.
     * @return EntryId instance.
     */
    public EntryId withWhen(long newWhen) {
        return new EntryId(newWhen, listDigest, unique);
    }

    public long getWhen() {
        return when;
    }

    public String getListDigest() {
        return listDigest;
    }

    /**
     * Stable part of the identifier.
     *
     * @return Digest and unique part.
     */
    public String key() {
        return listDigest + "+" + unique;
    }

    @Override
    public int compareTo(EntryId other) {
        int byTime = Long.compare(when, other.when);
        return byTime != 0 ? byTime : key().compareTo(other.key());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntryId)) return false;
        EntryId other = (EntryId) o;
        return when == other.when && listDigest.equals(other.listDigest) && unique.equals(other.unique);
    }

    @Override
    public int hashCode() {
        return Objects.hash(when, listDigest, unique);
    }

    @Override
    public String toString() {
        return String.format("%013d+%s+%s", when, listDigest, unique);
    }
}
