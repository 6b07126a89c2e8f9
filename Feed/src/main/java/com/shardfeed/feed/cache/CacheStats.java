package com.shardfeed.feed.cache;

/**
 * 캐시 통계 스냅샷 (불변)
 */
public record CacheStats(
    long hits,
    long misses,
    long inserts,
    long evictions,
    long invalidations
) {
    public long requests() {
        return hits + misses;
    }

    public double hitRate() {
        long requests = requests();
        return requests > 0 ? (double) hits / requests : 0.0;
    }

    @Override
    public String toString() {
        return String.format("CacheStats{hits=%d, misses=%d, hitRate=%.3f, inserts=%d, evictions=%d, invalidations=%d}",
                hits, misses, hitRate(), inserts, evictions, invalidations);
    }
}
