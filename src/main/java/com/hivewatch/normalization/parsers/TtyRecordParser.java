package com.hivewatch.normalization.parsers;

import com.hivewatch.domain.Event;
import com.hivewatch.domain.EventKind;
import com.hivewatch.domain.RawRecord;
import com.hivewatch.ingestion.TtyCaptureAdapter;
import org.springframework.stereotype.Component;

/**
 * Maps TTY capture notifications to tty_open / tty_data / tty_close events.
 */
@Component
public class TtyRecordParser implements RecordParser {

    public static final String FORMAT = "tty";

    @Override
    public Event parse(RawRecord record) {
        Object ttyEvent = record.getMetadata(TtyCaptureAdapter.TTY_EVENT);
        Object session = record.getMetadata(TtyCaptureAdapter.SESSION);
        if (ttyEvent == null || session == null) {
            throw new NormalizationException("TTY record without event or session metadata", FORMAT,
                String.valueOf(record.getMetadata()));
        }

        EventKind kind;
        switch (ttyEvent.toString()) {
            case "open":
                kind = EventKind.TTY_OPEN;
                break;
            case "data":
                kind = EventKind.TTY_DATA;
                break;
            case "close":
                kind = EventKind.TTY_CLOSE;
                break;
            default:
                throw new NormalizationException("Unknown TTY event " + ttyEvent, FORMAT, ttyEvent.toString());
        }

        return Event.builder()
            .timestamp(record.getReceivedAt())
            .sessionId(session.toString())
            .kind(kind)
            .source(record.getSource())
            .put(Event.TTYLOG, record.getMetadata(TtyCaptureAdapter.FILE))
            .put(Event.SIZE, record.getMetadata(TtyCaptureAdapter.BYTES))
            .build();
    }

    @Override
    public String getFormat() {
        return FORMAT;
    }
}
