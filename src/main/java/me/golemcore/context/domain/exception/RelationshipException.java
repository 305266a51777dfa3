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
 * Raised for a dangling parent or derivation reference, for a link that would
 * close a cycle, or for an attempt to relink an entry already in the store.
 */
public class RelationshipException extends ContextEngineException {

    private static final long serialVersionUID = 1L;

    private final String entryId;
    private final String relatedId;

    public RelationshipException(String entryId, String relatedId, String message) {
        super(message);
        this.entryId = entryId;
        this.relatedId = relatedId;
    }

    public static RelationshipException dangling(String entryId, String relatedId, String field) {
        return new RelationshipException(entryId, relatedId,
                "Entry " + entryId + " references missing entry " + relatedId + " in " + field);
    }

    public static RelationshipException cycle(String entryId, String relatedId, String graph) {
        return new RelationshipException(entryId, relatedId,
                "Linking " + entryId + " to " + relatedId + " would create a cycle in the " + graph + " graph");
    }

    public static RelationshipException immutable(String entryId, String relatedId, String field) {
        return new RelationshipException(entryId, relatedId,
                "Entry " + entryId + " already exists with a different " + field);
    }

    public String getEntryId() {
        return entryId;
    }

    public String getRelatedId() {
        return relatedId;
    }
}
