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

import me.golemcore.context.domain.exception.EntryValidationException;
import me.golemcore.context.domain.model.ContextEntry;

import java.util.List;

/**
 * Shape validation for context entries. Relationship checks that need the
 * store's contents live in {@link ContextStore}.
 */
public final class ContextEntryValidator {

    private ContextEntryValidator() {
    }

    /**
     * @throws EntryValidationException
     *             on the first violated rule
     */
    public static void validate(ContextEntry entry) {
        if (entry == null) {
            throw new EntryValidationException(null, "entry must not be null");
        }
        String id = entry.getId();
        if (!ContextIdSupport.isValid(id)) {
            throw new EntryValidationException(id, "id must match ctx_ followed by 8 alphanumeric characters");
        }
        if (entry.getEntryType() == null) {
            throw new EntryValidationException(id, "entryType is required");
        }
        if (isBlank(entry.getSource())) {
            throw new EntryValidationException(id, "source must not be empty");
        }
        if (isBlank(entry.getSummary())) {
            throw new EntryValidationException(id, "summary must not be empty");
        }
        if (entry.getCreatedAt() == null) {
            throw new EntryValidationException(id, "createdAt is required");
        }
        if (entry.isCompressed() && entry.getContent() != null) {
            throw new EntryValidationException(id, "compressed entry must not carry content");
        }
        if (entry.getTtl() != null && entry.getTtl() <= 0) {
            throw new EntryValidationException(id, "ttl must be a positive number of milliseconds");
        }
        validateIds(id, entry.getReferences(), "references");
        validateIds(id, entry.getDerivedFrom(), "derivedFrom");
    }

    private static void validateIds(String id, List<String> ids, String field) {
        if (ids == null) {
            return;
        }
        for (String value : ids) {
            if (isBlank(value)) {
                throw new EntryValidationException(id, field + " must not contain empty ids");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
