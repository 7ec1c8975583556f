package notifier.weather.sdk.cache;

import java.time.Instant;

/**
 * Snapshot of a cache's lookup counters.
 */
public final class CacheStats {
    private final long hits;
    private final long misses;
    private final Instant lastUpdated;

    public CacheStats(long hits, long misses, Instant lastUpdated) {
        this.hits = hits;
        this.misses = misses;
        this.lastUpdated = lastUpdated;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public long getTotalOps() {
        return hits + misses;
    }

    /**
     * Hits divided by total lookups, 0 when nothing has been looked up yet.
     */
    public double getHitRatio() {
        long total = getTotalOps();
        return total == 0 ? 0.0 : (double) hits / total;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    @Override
    public String toString() {
        return "CacheStats{hits=" + hits + ", misses=" + misses
                + ", totalOps=" + getTotalOps() + ", hitRatio=" + getHitRatio() + "}";
    }
}
