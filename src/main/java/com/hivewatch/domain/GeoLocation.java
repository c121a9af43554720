package com.hivewatch.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Geographic location resolved for an IP address.
 */
public final class GeoLocation {

    /**
     * Returned when the address is not covered by the database or the lookup
     * failed or timed out.
     */
    public static final GeoLocation UNKNOWN = new GeoLocation(null, "--", "Unknown", null, null, null, null);

    @JsonProperty("ip")
    private final String ip;

    @JsonProperty("country_code")
    private final String countryCode;

    @JsonProperty("country")
    private final String country;

    @JsonProperty("city")
    private final String city;

    @JsonProperty("latitude")
    private final Double latitude;

    @JsonProperty("longitude")
    private final Double longitude;

    @JsonProperty("lookup_timestamp")
    private final Instant lookupTimestamp;

    public GeoLocation(String ip, String countryCode, String country, String city,
                       Double latitude, Double longitude, Instant lookupTimestamp) {
        this.ip = ip;
        this.countryCode = countryCode;
        this.country = country;
        this.city = city;
        this.latitude = latitude;
        this.longitude = longitude;
        this.lookupTimestamp = lookupTimestamp;
    }

    public String getIp() {
        return ip;
    }

    public String getCountryCode() {
        return countryCode;
    }

    public String getCountry() {
        return country;
    }

    public String getCity() {
        return city;
    }

    public Double getLatitude() {
        return latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public Instant getLookupTimestamp() {
        return lookupTimestamp;
    }

    @JsonIgnore
    public boolean isKnown() {
        return this != UNKNOWN;
    }

    @Override
    public String toString() {
        return isKnown() ? country + (city != null ? "/" + city : "") : "Unknown";
    }
}
