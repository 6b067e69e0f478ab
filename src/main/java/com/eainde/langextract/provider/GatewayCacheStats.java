package com.eainde.langextract.provider;

/**
 * Response cache counters.
 */
public record GatewayCacheStats(boolean enabled, long size, long hits, long misses, long evictions) {

    public double hitRate() {
        long requests = hits + misses;
        return requests == 0 ? 0.0 : (double) hits / requests;
    }
}
