package com.fintech.ticks.storage;

import com.fintech.ticks.domain.CandlestickSummary;

import java.time.Instant;

/**
 * Candlestick row: {@code Symbol,MinuteOfDay,OpenPrice,ClosePrice,HighestPrice,LowestPrice,Transactions}.
 * {@code MinuteOfDay} is an ISO-8601 instant.
 */
public class CandlestickCodec implements RowCodec<CandlestickSummary> {

    public static final CandlestickCodec INSTANCE = new CandlestickCodec();

    private static final String HEADER = String.join(DELIMITER,
        "Symbol", "MinuteOfDay", "OpenPrice", "ClosePrice", "HighestPrice", "LowestPrice", "Transactions");

    @Override
    public String header() {
        return HEADER;
    }

    @Override
    public String format(CandlestickSummary summary) {
        return String.join(DELIMITER,
            summary.symbol(),
            summary.windowStart().toString(),
            Double.toString(summary.open()),
            Double.toString(summary.close()),
            Double.toString(summary.high()),
            Double.toString(summary.low()),
            Long.toString(summary.count()));
    }

    @Override
    public CandlestickSummary parse(String row) {
        String[] fields = RowCodec.split(row, 7);
        return new CandlestickSummary(
            fields[0],
            Instant.parse(fields[1]),
            Double.parseDouble(fields[2]),
            Double.parseDouble(fields[3]),
            Double.parseDouble(fields[4]),
            Double.parseDouble(fields[5]),
            Long.parseLong(fields[6])
        );
    }
}
