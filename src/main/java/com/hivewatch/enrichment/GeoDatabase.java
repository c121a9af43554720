package com.hivewatch.enrichment;

import com.google.common.base.Splitter;
import com.google.common.net.InetAddresses;
import com.hivewatch.domain.GeoLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Range-based GeoIP database read from a CSV file with rows
 * {@code start_ip,end_ip,country_code,country,city,lat,lon}.
 */
public class GeoDatabase implements GeoLookup {

    private static final Logger log = LoggerFactory.getLogger(GeoDatabase.class);

    private static final Splitter CSV = Splitter.on(',').trimResults();

    private final TreeMap<BigInteger, Range> ranges;
    private final Clock clock;
    private final boolean loaded;

    private GeoDatabase(TreeMap<BigInteger, Range> ranges, Clock clock, boolean loaded) {
        this.ranges = ranges;
        this.clock = clock;
        this.loaded = loaded;
    }

    /**
     * Database with no data; every lookup reports the source as unavailable.
     */
    public static GeoDatabase empty(Clock clock) {
        return new GeoDatabase(new TreeMap<>(), clock, false);
    }

    public static GeoDatabase load(Path path, Clock clock) throws IOException {
        TreeMap<BigInteger, Range> ranges = new TreeMap<>();
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank() || line.startsWith("#") || line.startsWith("start_ip")) {
                    continue;
                }
                try {
                    Range range = Range.parse(line);
                    ranges.put(range.start, range);
                } catch (IllegalArgumentException e) {
                    skipped++;
                }
            }
        }
        log.info("Loaded {} GeoIP ranges from {} ({} rows skipped)", ranges.size(), path, skipped);
        return new GeoDatabase(ranges, clock, true);
    }

    @Override
    public Optional<GeoLocation> locate(String ip) {
        if (!loaded) {
            throw new EnrichmentUnavailableException("No GeoIP database loaded", ip);
        }
        if (ip == null || !InetAddresses.isInetAddress(ip)) {
            return Optional.empty();
        }
        BigInteger value = InetAddresses.toBigInteger(InetAddresses.forString(ip));
        Map.Entry<BigInteger, Range> entry = ranges.floorEntry(value);
        if (entry == null || entry.getValue().end.compareTo(value) < 0) {
            return Optional.empty();
        }
        Range range = entry.getValue();
        return Optional.of(new GeoLocation(ip, range.countryCode, range.country, range.city,
            range.latitude, range.longitude, clock.instant()));
    }

    public int size() {
        return ranges.size();
    }

    private static final class Range {
        private final BigInteger start;
        private final BigInteger end;
        private final String countryCode;
        private final String country;
        private final String city;
        private final Double latitude;
        private final Double longitude;

        private Range(BigInteger start, BigInteger end, String countryCode, String country, String city,
                      Double latitude, Double longitude) {
            this.start = start;
            this.end = end;
            this.countryCode = countryCode;
            this.country = country;
            this.city = city;
            this.latitude = latitude;
            this.longitude = longitude;
        }

        static Range parse(String line) {
            List<String> cols = CSV.splitToList(line);
            if (cols.size() < 7) {
                throw new IllegalArgumentException("Expected 7 columns: " + line);
            }
            BigInteger start = InetAddresses.toBigInteger(InetAddresses.forString(cols.get(0)));
            BigInteger end = InetAddresses.toBigInteger(InetAddresses.forString(cols.get(1)));
            if (end.compareTo(start) < 0) {
                throw new IllegalArgumentException("Range end before start: " + line);
            }
            return new Range(start, end, cols.get(2), cols.get(3), emptyToNull(cols.get(4)),
                parseDouble(cols.get(5)), parseDouble(cols.get(6)));
        }

        private static String emptyToNull(String value) {
            return value.isEmpty() ? null : value;
        }

        private static Double parseDouble(String value) {
            if (value.isEmpty()) {
                return null;
            }
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid coordinate " + value, e);
            }
        }
    }
}
