package com.hivewatch.ingestion;

import com.hivewatch.domain.RawRecord;

import java.util.List;

/**
 * Reads one physical honeypot source and hands back the records that became
 * available since the previous call.
 *
 * Implementations keep their own position and survive the source disappearing
 * and reappearing: a poll after a {@link SourceUnavailableException} resumes
 * from the reopened source rather than from scratch.
 */
public interface SourceAdapter extends AutoCloseable {

    /**
     * Stable name used for logging and metric tags.
     */
    String name();

    /**
     * Returns the records read since the last poll, in source order.
     * An empty list means no new data.
     *
     * @throws SourceUnavailableException if the underlying path is gone or unreadable
     */
    List<RawRecord> poll();

    /**
     * Releases file handles. Further polls reopen the source.
     */
    @Override
    void close();
}
