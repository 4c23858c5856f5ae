package com.amqpharness.pool;

/**
 * Point-in-time counters for one pool key.
 */
public final class PoolStats {

    private final int created;
    private final int idle;
    private final int leased;

    public PoolStats(int created, int idle, int leased) {
        this.created = created;
        this.idle = idle;
        this.leased = leased;
    }

    public static PoolStats empty() {
        return new PoolStats(0, 0, 0);
    }

    /** Total resources ever created for the key. */
    public int getCreated() {
        return created;
    }

    public int getIdle() {
        return idle;
    }

    public int getLeased() {
        return leased;
    }

    @Override
    public String toString() {
        return String.format("PoolStats{created=%d, idle=%d, leased=%d}", created, idle, leased);
    }
}
