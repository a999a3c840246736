package com.fintech.ticks.storage;

import com.fintech.ticks.domain.TickRecord;

/**
 * Tick row: {@code Symbol,Price,Timestamp,WriteTimestamp}, both timestamps in epoch millis.
 */
public class TickRecordCodec implements RowCodec<TickRecord> {

    public static final TickRecordCodec INSTANCE = new TickRecordCodec();

    private static final String HEADER = String.join(DELIMITER,
        "Symbol", "Price", "Timestamp", "WriteTimestamp");

    @Override
    public String header() {
        return HEADER;
    }

    @Override
    public String format(TickRecord record) {
        return record.symbol() + DELIMITER
            + record.price() + DELIMITER
            + record.observedAt() + DELIMITER
            + record.recordedAt();
    }

    @Override
    public TickRecord parse(String row) {
        String[] fields = RowCodec.split(row, 4);
        return new TickRecord(
            fields[0],
            Double.parseDouble(fields[1]),
            Long.parseLong(fields[2]),
            Long.parseLong(fields[3])
        );
    }
}
