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
 * Raised when an operation targets an entry id the store does not hold.
 */
public class EntryNotFoundException extends ContextEngineException {

    private static final long serialVersionUID = 1L;

    private final String entryId;

    public EntryNotFoundException(String entryId) {
        super("Context entry not found: " + entryId);
        this.entryId = entryId;
    }

    public String getEntryId() {
        return entryId;
    }
}
