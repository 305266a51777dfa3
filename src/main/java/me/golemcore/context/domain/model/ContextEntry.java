package me.golemcore.context.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One unit of knowledge captured during planning or execution.
 *
 * <p>
 * Entries are addressed by an id of the form {@code ctx_XXXXXXXX}. The store
 * assigns {@code id} and {@code createdAt} when they are missing. Once
 * {@code compressed} is set, {@code content} is gone for good and only
 * {@code summary} remains.
 *
 * <p>
 * {@code ttl} is a lifetime in milliseconds counted from {@code createdAt};
 * {@code null} means the entry never expires.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ContextEntry {

    private String id;
    private EntryType entryType;
    private String source;
    private String content;
    private String summary;
    private Instant createdAt;

    @Builder.Default
    private List<String> references = new ArrayList<>();

    @Builder.Default
    private boolean searchable = true;

    private boolean compressed;
    private Long ttl;
    private String parentId;

    @Builder.Default
    private List<String> derivedFrom = new ArrayList<>();

    public boolean hasTtl() {
        return ttl != null;
    }

    /**
     * Instant after which the entry counts as expired, or {@code null} when it
     * has no TTL.
     */
    public Instant expiresAt() {
        if (ttl == null || createdAt == null) {
            return null;
        }
        return createdAt.plusMillis(ttl);
    }

    public boolean isExpired(Instant now) {
        Instant expiresAt = expiresAt();
        return expiresAt != null && now.isAfter(expiresAt);
    }

    /**
     * Text used for lexical indexing: content while it is available, summary
     * otherwise.
     */
    public String indexableText() {
        if (!compressed && content != null && !content.isBlank()) {
            return content;
        }
        return summary != null ? summary : "";
    }

    /**
     * Deep copy, so callers never share list instances with the store.
     */
    public ContextEntry copy() {
        return toBuilder()
                .references(references != null ? new ArrayList<>(references) : new ArrayList<>())
                .derivedFrom(derivedFrom != null ? new ArrayList<>(derivedFrom) : new ArrayList<>())
                .build();
    }
}
