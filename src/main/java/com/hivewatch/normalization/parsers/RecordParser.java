package com.hivewatch.normalization.parsers;

import com.hivewatch.domain.Event;
import com.hivewatch.domain.RawRecord;

/**
 * Maps one source-specific raw record onto the canonical {@link Event}.
 * Implementations are stateless and side-effect free.
 */
public interface RecordParser {

    /**
     * @throws NormalizationException if the record cannot be mapped
     */
    Event parse(RawRecord record);

    /**
     * Format identifier this parser handles (e.g. "cowrie:json", "tty").
     */
    String getFormat();
}
