package com.hivewatch.normalization;

import com.hivewatch.domain.RawRecord;
import com.hivewatch.normalization.parsers.AuditLineParser;
import com.hivewatch.normalization.parsers.CowrieJsonParser;
import com.hivewatch.normalization.parsers.DownloadRecordParser;
import com.hivewatch.normalization.parsers.TtyRecordParser;
import org.springframework.stereotype.Component;

/**
 * Picks the record format from the source type and, for log lines, a content sniff.
 * A JSON log may contain stray text lines and vice versa, so log lines are always sniffed.
 */
@Component
public class FormatDetector {

    public static final String UNKNOWN = "unknown";

    public String detect(RawRecord record) {
        if (record.getSourceType() == null) {
            return UNKNOWN;
        }
        switch (record.getSourceType()) {
            case TTY_CAPTURE:
                return TtyRecordParser.FORMAT;
            case DOWNLOAD_DIR:
                return DownloadRecordParser.FORMAT;
            case JSON_LOG:
            case TEXT_LOG:
                return detectLine(record.getData());
            default:
                return UNKNOWN;
        }
    }

    private String detectLine(byte[] data) {
        if (data == null || data.length == 0) {
            return UNKNOWN;
        }
        int i = 0;
        while (i < data.length && Character.isWhitespace(data[i])) {
            i++;
        }
        if (i == data.length) {
            return UNKNOWN;
        }
        if (data[i] == '{') {
            return CowrieJsonParser.FORMAT;
        }
        if (Character.isDigit(data[i])) {
            return AuditLineParser.FORMAT;
        }
        return UNKNOWN;
    }
}
