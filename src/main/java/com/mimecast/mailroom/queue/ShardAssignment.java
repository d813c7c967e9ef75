package com.mimecast.mailroom.queue;

/**
 * Shard assignment of one runner instance.
 */
public final class ShardAssignment {

    /**
     * Single shard claiming everything.
     */
    public static final ShardAssignment ALL = new ShardAssignment(ShardStrategy.MODULO, 0, 1);

    private final ShardStrategy strategy;
    private final int shard;
    private final int shards;

    /**
     * Constructs a new ShardAssignment.
     *
     * @param strategy Hashing strategy.
     * @param shard    Zero based shard index.
     * @param shards   Shard count.
     * @throws IllegalArgumentException Shard out of range.
     */
    public ShardAssignment(ShardStrategy strategy, int shard, int shards) {
        if (shards < 1) {
            throw new IllegalArgumentException("shards must be >= 1, got: " + shards);
        }
        if (shard < 0 || shard >= shards) {
            throw new IllegalArgumentException("shard must be in [0, " + shards + "), got: " + shard);
        }
        this.strategy = strategy;
        this.shard = shard;
        this.shards = shards;
    }

    /**
     * Checks if this assignment owns an entry.
     *
     * @param id Entry id.
     * @return Boolean.
     */
    public boolean claims(EntryId id) {
        return shards == 1 || strategy.shardOf(id.getListDigest(), shards) == shard;
    }

    public int getShard() {
        return shard;
    }

    public int getShards() {
        return shards;
    }

    public ShardStrategy getStrategy() {
        return strategy;
    }

    @Override
    public String toString() {
        return strategy.name().toLowerCase() + ":" + shard + "/" + shards;
    }
}
