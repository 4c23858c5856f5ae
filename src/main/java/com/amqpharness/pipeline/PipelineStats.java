package com.amqpharness.pipeline;

public final class PipelineStats {

    private final int created;
    private final int live;
    private final int idle;
    private final int leased;
    private final int peakLeased;

    PipelineStats(int created, int live, int idle, int leased, int peakLeased) {
        this.created = created;
        this.live = live;
        this.idle = idle;
        this.leased = leased;
        this.peakLeased = peakLeased;
    }

    public int getCreated() {
        return created;
    }

    /** Created and not yet destroyed. */
    public int getLive() {
        return live;
    }

    public int getIdle() {
        return idle;
    }

    public int getLeased() {
        return leased;
    }

    /** High-water mark of concurrently outstanding leases. */
    public int getPeakLeased() {
        return peakLeased;
    }

    @Override
    public String toString() {
        return String.format("PipelineStats{created=%d, live=%d, idle=%d, leased=%d, peakLeased=%d}",
                           created, live, idle, leased, peakLeased);
    }
}
