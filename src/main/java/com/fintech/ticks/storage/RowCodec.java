package com.fintech.ticks.storage;

/**
 * Maps one record type to and from a single delimited text row with a fixed field order.
 *
 * @param <T> record type
 */
public interface RowCodec<T> {

    String DELIMITER = ",";

    /** Header row naming the fields, in row order. */
    String header();

    /** Formats a record as one row, without the line terminator. */
    String format(T value);

    /**
     * Parses one row.
     *
     * @throws IllegalArgumentException if the row does not have the expected shape
     * @throws java.time.DateTimeException if a timestamp field cannot be parsed
     */
    T parse(String row);

    /**
     * Splits a row and checks the field count.
     */
    static String[] split(String row, int expectedFields) {
        String[] fields = row.split(DELIMITER, -1);
        if (fields.length != expectedFields) {
            throw new IllegalArgumentException(
                "Expected " + expectedFields + " fields but found " + fields.length);
        }
        return fields;
    }
}
