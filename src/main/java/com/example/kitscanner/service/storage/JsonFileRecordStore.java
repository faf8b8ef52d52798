package com.example.kitscanner.service.storage;

import com.example.kitscanner.model.RecordType;
import com.example.kitscanner.model.StoredRecord;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Keeps one JSON array file per day, named {@code <prefix>_<MM-dd-yy>[_<location>].json}. Every write loads
 * the whole day's list, modifies it and replaces the file through a temporary sibling.
 */
public class JsonFileRecordStore<T extends StoredRecord> implements RecordStore<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonFileRecordStore.class);

    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("MM-dd-yy");

    private final Path directory;
    private final String prefix;
    private final String locationId;
    private final ObjectMapper objectMapper;
    private final JavaType listType;
    private final Clock clock;

    public JsonFileRecordStore(Path directory, String prefix, String locationId, Class<T> recordClass,
            ObjectMapper objectMapper, Clock clock) {
        this.directory = directory;
        this.prefix = prefix;
        this.locationId = locationId;
        this.objectMapper = objectMapper;
        this.listType = objectMapper.getTypeFactory().constructCollectionType(List.class, recordClass);
        this.clock = clock;
    }

    @Override
    public synchronized boolean appendRecord(T record) {
        if (record == null) {
            return false;
        }
        Path file = fileFor(LocalDate.now(clock));
        try {
            List<T> records = read(file);
            records.add(record);
            write(file, records);
            log.info("Appended {} record to {} ({} today)", record.type(), file.getFileName(), records.size());
            return true;
        } catch (IOException ex) {
            log.error("Failed to append {} record to {}", record.type(), file, ex);
            return false;
        }
    }

    @Override
    public synchronized boolean deleteMostRecent(RecordType type) {
        Path file = fileFor(LocalDate.now(clock));
        try {
            List<T> records = read(file);
            Optional<T> latest = records.stream()
                    .filter(record -> record.type() == type)
                    .max(Comparator.comparing(JsonFileRecordStore::timestampOf));
            if (latest.isEmpty()) {
                log.info("No {} record to delete in {}", type, file.getFileName());
                return false;
            }
            records.remove(latest.get());
            write(file, records);
            log.info("Deleted most recent {} record ({}) from {}", type, latest.get().timestamp(), file.getFileName());
            return true;
        } catch (IOException ex) {
            log.error("Failed to delete most recent {} record from {}", type, file, ex);
            return false;
        }
    }

    @Override
    public synchronized List<T> recordsForDate(LocalDate date) {
        Path file = fileFor(date);
        try {
            return List.copyOf(read(file));
        } catch (IOException ex) {
            log.error("Failed to read records from {}", file, ex);
            return List.of();
        }
    }

    @Override
    public List<T> recordsForToday() {
        return recordsForDate(LocalDate.now(clock));
    }

    Path fileFor(LocalDate date) {
        StringBuilder name = new StringBuilder(prefix).append('_').append(date.format(FILE_DATE));
        if (StringUtils.hasText(locationId)) {
            name.append('_').append(locationId.trim());
        }
        return directory.resolve(name.append(".json").toString());
    }

    private List<T> read(Path file) throws IOException {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        String content = Files.readString(file, StandardCharsets.UTF_8);
        if (content.isBlank()) {
            return new ArrayList<>();
        }
        List<T> records = objectMapper.readValue(content, listType);
        return records == null ? new ArrayList<>() : new ArrayList<>(records);
    }

    private void write(Path file, List<T> records) throws IOException {
        Files.createDirectories(file.getParent());
        Path tmp = file.resolveSibling(file.getFileName().toString() + ".tmp");
        Files.writeString(tmp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(records),
                StandardCharsets.UTF_8);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    }

    private static Instant timestampOf(StoredRecord record) {
        if (record.timestamp() == null) {
            return Instant.MIN;
        }
        try {
            return Instant.parse(record.timestamp());
        } catch (DateTimeParseException ex) {
            return Instant.MIN;
        }
    }
}
