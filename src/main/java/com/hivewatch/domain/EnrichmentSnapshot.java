package com.hivewatch.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Geolocation and reputation captured for an alert at the moment it was generated.
 */
public final class EnrichmentSnapshot {

    public static final EnrichmentSnapshot UNKNOWN =
        new EnrichmentSnapshot(GeoLocation.UNKNOWN, ReputationVerdict.UNKNOWN);

    @JsonProperty("geo")
    private final GeoLocation geo;

    @JsonProperty("reputation")
    private final ReputationVerdict reputation;

    public EnrichmentSnapshot(GeoLocation geo, ReputationVerdict reputation) {
        this.geo = geo != null ? geo : GeoLocation.UNKNOWN;
        this.reputation = reputation != null ? reputation : ReputationVerdict.UNKNOWN;
    }

    public GeoLocation getGeo() {
        return geo;
    }

    public ReputationVerdict getReputation() {
        return reputation;
    }

    public boolean isUnknown() {
        return !geo.isKnown() && !reputation.isKnown();
    }

    @Override
    public String toString() {
        return "geo=" + geo + ", reputation=" + reputation;
    }
}
