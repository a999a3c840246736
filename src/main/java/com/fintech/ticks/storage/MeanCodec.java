package com.fintech.ticks.storage;

import com.fintech.ticks.domain.MeanSummary;

import java.time.Instant;

/**
 * Mean row: {@code Symbol,StartTime,EndTime,MeanPrice,Transactions}, instants in ISO-8601.
 */
public class MeanCodec implements RowCodec<MeanSummary> {

    public static final MeanCodec INSTANCE = new MeanCodec();

    private static final String HEADER = String.join(DELIMITER,
        "Symbol", "StartTime", "EndTime", "MeanPrice", "Transactions");

    @Override
    public String header() {
        return HEADER;
    }

    @Override
    public String format(MeanSummary summary) {
        return String.join(DELIMITER,
            summary.symbol(),
            summary.startTime().toString(),
            summary.endTime().toString(),
            Double.toString(summary.meanPrice()),
            Long.toString(summary.count()));
    }

    @Override
    public MeanSummary parse(String row) {
        String[] fields = RowCodec.split(row, 5);
        return new MeanSummary(
            fields[0],
            Instant.parse(fields[1]),
            Instant.parse(fields[2]),
            Double.parseDouble(fields[3]),
            Long.parseLong(fields[4])
        );
    }
}
