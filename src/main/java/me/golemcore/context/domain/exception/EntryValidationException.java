package me.golemcore.context.domain.exception;

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

/**
 * Raised when an entry is malformed: bad id, missing required field, invalid
 * TTL, or a compressed entry that still carries content.
 */
public class EntryValidationException extends ContextEngineException {

    private static final long serialVersionUID = 1L;

    private final String entryId;

    public EntryValidationException(String entryId, String message) {
        super(entryId != null ? "Invalid entry " + entryId + ": " + message : "Invalid entry: " + message);
        this.entryId = entryId;
    }

    public String getEntryId() {
        return entryId;
    }
}
