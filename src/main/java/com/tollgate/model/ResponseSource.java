package com.tollgate.model;

/**
 * Where a resolved completion came from.
 */
public enum ResponseSource {
    CACHE,      // live cache entry
    UPSTREAM,   // this caller triggered the provider call
    COALESCED,  // joined another caller's in-flight provider call
    BYPASS;     // skipCache request, never cached

    public boolean isCacheHit() {
        return this == CACHE;
    }

    /**
     * Whether this caller's request reached the provider. Joiners share the
     * leader's call and cost nothing extra.
     */
    public boolean isUpstreamCall() {
        return this == UPSTREAM || this == BYPASS;
    }

    public String headerValue() {
        return name().toLowerCase();
    }
}
