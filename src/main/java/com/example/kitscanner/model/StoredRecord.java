package com.example.kitscanner.model;

/**
 * A finalized, immutable record handed to a {@code RecordStore}.
 */
public interface StoredRecord {

    RecordType type();

    /**
     * @return ISO-8601 instant at which the record was created
     */
    String timestamp();
}
