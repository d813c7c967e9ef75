package com.mimecast.mailroom.queue;

import java.math.BigInteger;
import java.util.Locale;

/**
 * Maps a list digest onto one of {@code shards} partitions.
 */
public enum ShardStrategy {

    /**
     * Digest value modulo the shard count.
     */
    MODULO {
        @Override
        public int shardOf(String listDigest, int shards) {
            return new BigInteger(listDigest, 16).mod(BigInteger.valueOf(shards)).intValue();
        }
    },

    /**
     * Digest space split into equal contiguous ranges.
     */
    RANGE {
        @Override
        public int shardOf(String listDigest, int shards) {
            // shard = floor(digest * shards / 2^160) keeps ranges contiguous and gap free.
            return new BigInteger(listDigest, 16)
                    .multiply(BigInteger.valueOf(shards))
                    .shiftRight(160)
                    .intValue();
        }
    };

    /**
     * Computes the owning shard.
     *
     * @param listDigest 40 hex digit SHA-1.
     * @param shards     Shard count, at least 1.
     * @return Shard index in {@code [0, shards)}.
     */
    public abstract int shardOf(String listDigest, int shards);

    /**
     * Parses a configuration value.
     *
     * @param value String, case insensitive.
     * @return ShardStrategy.
     * @throws IllegalArgumentException Unknown value.
     */
    public static ShardStrategy fromString(String value) {
        return ShardStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
