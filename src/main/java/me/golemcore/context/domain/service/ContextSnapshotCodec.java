package me.golemcore.context.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.context.domain.exception.ContextEngineException;
import me.golemcore.context.domain.exception.EntryValidationException;
import me.golemcore.context.domain.model.ContextEntry;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts context entries to and from the plain snapshot representation used
 * by checkpointing.
 *
 * <p>
 * A snapshot maps entry id to an object mirroring the entry fields in
 * snake_case ({@code entry_type}, {@code created_at}, {@code parent_id},
 * {@code derived_from}, ...). {@code created_at} is an ISO-8601 string; on
 * read, instants, offset date-times and zone-less local date-times (taken in
 * the clock's zone) are all accepted.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class ContextSnapshotCodec {

    private static final String CREATED_AT = "created_at";
    private static final String CREATED_AT_CAMEL = "createdAt";
    private static final TypeReference<Map<String, Object>> ENTRY_MAP_TYPE_REF = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Map<String, Object>>> SNAPSHOT_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper snapshotMapper;
    private final Clock clock;

    public ContextSnapshotCodec(ObjectMapper objectMapper, Clock clock) {
        this.snapshotMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.clock = clock;
    }

    public Map<String, Object> toMap(ContextEntry entry) {
        Map<String, Object> map = snapshotMapper.convertValue(entry, ENTRY_MAP_TYPE_REF);
        map.put(CREATED_AT, entry.getCreatedAt() != null ? entry.getCreatedAt().toString() : null);
        return map;
    }

    /**
     * Rebuild an entry from its snapshot object.
     *
     * @throws EntryValidationException
     *             if the object cannot be mapped onto an entry
     */
    public ContextEntry fromMap(Map<String, Object> map) {
        Map<String, Object> fields = new LinkedHashMap<>(map);
        Object rawCreatedAt = fields.remove(CREATED_AT);
        Object rawCamelCreatedAt = fields.remove(CREATED_AT_CAMEL);
        if (rawCreatedAt == null) {
            rawCreatedAt = rawCamelCreatedAt;
        }
        Object rawId = fields.get("id");

        ContextEntry entry;
        try {
            entry = snapshotMapper.convertValue(fields, ContextEntry.class);
        } catch (IllegalArgumentException e) {
            throw new EntryValidationException(rawId != null ? rawId.toString() : null,
                    "unreadable snapshot entry: " + e.getMessage());
        }
        if (rawCreatedAt != null) {
            entry.setCreatedAt(parseTimestamp(entry.getId(), rawCreatedAt.toString()));
        }
        if (entry.getReferences() == null) {
            entry.setReferences(new ArrayList<>());
        }
        if (entry.getDerivedFrom() == null) {
            entry.setDerivedFrom(new ArrayList<>());
        }
        return entry;
    }

    public Map<String, Map<String, Object>> toSnapshot(Collection<ContextEntry> entries) {
        Map<String, Map<String, Object>> snapshot = new LinkedHashMap<>();
        for (ContextEntry entry : entries) {
            snapshot.put(entry.getId(), toMap(entry));
        }
        return snapshot;
    }

    /**
     * Rebuild all entries of a snapshot. An entry object without an id takes
     * the id of its key.
     *
     * @throws EntryValidationException
     *             if an object's id disagrees with its key
     */
    public List<ContextEntry> fromSnapshot(Map<String, Map<String, Object>> snapshot) {
        List<ContextEntry> entries = new ArrayList<>();
        if (snapshot == null) {
            return entries;
        }
        for (Map.Entry<String, Map<String, Object>> row : snapshot.entrySet()) {
            if (row.getValue() == null) {
                continue;
            }
            ContextEntry entry = fromMap(row.getValue());
            if (entry.getId() == null) {
                entry.setId(row.getKey());
            } else if (!entry.getId().equals(row.getKey())) {
                throw new EntryValidationException(row.getKey(),
                        "snapshot key does not match entry id " + entry.getId());
            }
            entries.add(entry);
        }
        return entries;
    }

    public String toJson(Map<String, Map<String, Object>> snapshot) {
        try {
            return snapshotMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new ContextEngineException("Failed to serialize context snapshot", e);
        }
    }

    public Map<String, Map<String, Object>> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return snapshotMapper.readValue(json, SNAPSHOT_TYPE_REF);
        } catch (JsonProcessingException e) {
            throw new ContextEngineException("Failed to parse context snapshot", e);
        }
    }

    private Instant parseTimestamp(String entryId, String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.trace("[SnapshotCodec] {} is not an instant, trying offset date-time", value);
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.trace("[SnapshotCodec] {} is not an offset date-time, trying local date-time", value);
        }
        try {
            return LocalDateTime.parse(value).atZone(clock.getZone()).toInstant();
        } catch (DateTimeParseException e) {
            throw new EntryValidationException(entryId, "created_at is not an ISO-8601 timestamp: " + value);
        }
    }
}
