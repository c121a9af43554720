package com.hivewatch.ingestion;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashSet;

/**
 * Bounded memory of recently delivered records, keyed on the record's embedded
 * timestamp and a hash of the raw line. Oldest keys are forgotten first.
 *
 * Not thread-safe; each adapter owns one and polls from a single thread.
 */
final class DedupWindow {

    private final int capacity;
    private final LinkedHashSet<String> keys = new LinkedHashSet<>();

    DedupWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Dedup window capacity must be positive");
        }
        this.capacity = capacity;
    }

    /**
     * Records the line and returns true when it was not seen within the window.
     */
    boolean firstSighting(String timestamp, String line) {
        String key = (timestamp != null ? timestamp : "") + '|'
            + Hashing.murmur3_128().hashString(line, StandardCharsets.UTF_8);
        if (keys.contains(key)) {
            return false;
        }
        keys.add(key);
        if (keys.size() > capacity) {
            Iterator<String> oldest = keys.iterator();
            oldest.next();
            oldest.remove();
        }
        return true;
    }

    int size() {
        return keys.size();
    }
}
