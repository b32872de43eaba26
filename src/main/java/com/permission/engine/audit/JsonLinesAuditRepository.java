package com.permission.engine.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * File-backed audit repository writing one JSON document per line.
 * Appends are serialized on this instance; queries re-read the file.
 */
public class JsonLinesAuditRepository implements AuditRepository {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesAuditRepository.class);

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonLinesAuditRepository(Path file) {
        this.file = file;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized AuditEntry save(AuditEntry entry) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writer.write(objectMapper.writeValueAsString(entry));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append audit entry to " + file, e);
        }
        log.debug("Persisted audit entry: {} for {}", entry.action(), entry.subject());
        return entry;
    }

    @Override
    public synchronized List<AuditEntry> findAll() {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<AuditEntry> entries = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    entries.add(parse(line));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit log " + file, e);
        }
        return List.copyOf(entries);
    }

    @Override
    public List<AuditEntry> findBySubject(String subject) {
        return findAll().stream()
                .filter(e -> subject.equals(e.subject()))
                .toList();
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return findAll().stream()
                .filter(e -> e.action() == action)
                .toList();
    }

    @Override
    public List<AuditEntry> findBetween(Instant start, Instant end) {
        return findAll().stream()
                .filter(e -> !e.timestamp().isBefore(start) && !e.timestamp().isAfter(end))
                .toList();
    }

    @Override
    public int count() {
        return findAll().size();
    }

    public Path getFile() {
        return file;
    }

    private AuditEntry parse(String line) {
        try {
            return objectMapper.readValue(line, AuditEntry.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Corrupt audit line in " + file, e);
        }
    }
}
