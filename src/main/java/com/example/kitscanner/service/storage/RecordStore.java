package com.example.kitscanner.service.storage;

import com.example.kitscanner.model.RecordType;
import com.example.kitscanner.model.StoredRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * Append-only store of finalized records. Implementations report failure through return values and never
 * leave a partially applied write behind.
 */
public interface RecordStore<T extends StoredRecord> {

    boolean appendRecord(T record);

    /**
     * Deletes the record of the given type with the latest timestamp from today's records.
     *
     * @return {@code false} when there was nothing to delete or the delete could not be written
     */
    boolean deleteMostRecent(RecordType type);

    List<T> recordsForDate(LocalDate date);

    List<T> recordsForToday();
}
