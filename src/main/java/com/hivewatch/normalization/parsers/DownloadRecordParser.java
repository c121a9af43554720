package com.hivewatch.normalization.parsers;

import com.hivewatch.domain.Event;
import com.hivewatch.domain.EventKind;
import com.hivewatch.domain.RawRecord;
import com.hivewatch.ingestion.DownloadDirectoryAdapter;
import org.springframework.stereotype.Component;

/**
 * Maps a captured-download notification to a file_download event. The download directory
 * does not know which session fetched the file, so the event is grouped under
 * {@code download:<sha256 prefix>}.
 */
@Component
public class DownloadRecordParser implements RecordParser {

    public static final String FORMAT = "download";
    public static final String SESSION_PREFIX = "download:";

    @Override
    public Event parse(RawRecord record) {
        Object sha256 = record.getMetadata(DownloadDirectoryAdapter.SHA256);
        if (sha256 == null || sha256.toString().length() < 12) {
            throw new NormalizationException("Download record without digest", FORMAT, record.asText());
        }
        String digest = sha256.toString();

        return Event.builder()
            .timestamp(record.getReceivedAt())
            .sessionId(SESSION_PREFIX + digest.substring(0, 12))
            .kind(EventKind.FILE_DOWNLOAD)
            .source(record.getSource())
            .put(Event.SHASUM, digest)
            .put(Event.SIZE, record.getMetadata(DownloadDirectoryAdapter.SIZE))
            .put(Event.OUTFILE, record.getMetadata(DownloadDirectoryAdapter.FILE))
            .put(Event.FILENAME, record.asText())
            .build();
    }

    @Override
    public String getFormat() {
        return FORMAT;
    }
}
