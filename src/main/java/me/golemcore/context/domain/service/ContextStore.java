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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.context.domain.exception.EntryNotFoundException;
import me.golemcore.context.domain.exception.RelationshipException;
import me.golemcore.context.domain.model.ContextEntry;
import me.golemcore.context.domain.model.ContextSearchResult;
import me.golemcore.context.domain.model.ContextStats;
import me.golemcore.context.domain.model.EntryType;
import me.golemcore.context.domain.model.SearchHit;
import me.golemcore.context.graph.RelationshipGraph;
import me.golemcore.context.search.VectorSearchIndex;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Owned composition point of the context engine: the id to entry map plus one
 * {@link VectorSearchIndex} and one {@link RelationshipGraph}.
 *
 * <p>
 * Invariants enforced on every mutation:
 * <ul>
 * <li>ids follow {@code ctx_XXXXXXXX} and are never reassigned</li>
 * <li>a compressed entry has no content and a non-empty summary</li>
 * <li>parent and derivation references point at entries present in the
 * store</li>
 * <li>neither the parent graph nor the derivation graph contains a cycle</li>
 * </ul>
 * Validation runs to completion before the first change, so a rejected
 * {@link #add} leaves map, index and graph untouched.
 *
 * <p>
 * Entries whose TTL has elapsed are hidden from {@link #get}, {@link #getAll},
 * {@link #getByType}, {@link #search} and {@link #getStats} even while they
 * still sit in the map waiting for the sweeper.
 *
 * <p>
 * Writes are serialized behind a single write lock; reads share a read lock.
 * Callers always receive copies, never the stored instances.
 *
 * @since 1.0
 * @see me.golemcore.context.sweeper.ExpirationSweeper
 */
@Service
@Slf4j
public class ContextStore {

    private static final int MAX_ID_ATTEMPTS = 16;

    private final Clock clock;
    private final ContextSnapshotCodec snapshotCodec;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private Map<String, ContextEntry> entries = new LinkedHashMap<>();
    private VectorSearchIndex searchIndex = new VectorSearchIndex();
    private RelationshipGraph relationships = new RelationshipGraph();

    public ContextStore(Clock clock, ContextSnapshotCodec snapshotCodec) {
        this.clock = clock;
        this.snapshotCodec = snapshotCodec;
    }

    // ==================== Mutations ====================

    /**
     * Validate and insert an entry. An existing entry with the same id is
     * replaced, but its parent and derivation sources must stay the same, and a
     * compressed entry stays compressed: new content is dropped.
     *
     * <p>
     * An entry that arrives already compressed is not indexed and stays out of
     * search until a snapshot restore, which indexes every searchable entry. An
     * update to an entry compressed in the store keeps it indexed through its
     * summary, as {@link #compress(String)} does.
     *
     * @return the id of the stored entry, generated when the entry had none
     * @throws me.golemcore.context.domain.exception.EntryValidationException
     *             if the entry is malformed
     * @throws RelationshipException
     *             for a dangling reference, a link that would close a cycle, or
     *             a changed parent or source list on an existing id
     */
    public String add(ContextEntry entry) {
        return write(() -> {
            ContextEntry candidate = prepare(entry);
            if (candidate != null && candidate.getId() != null) {
                ContextEntry existing = entries.get(candidate.getId());
                if (existing != null) {
                    mergeIntoExisting(candidate, existing);
                }
            }
            ContextEntryValidator.validate(candidate);
            validateRelationships(candidate, entries);

            String id = candidate.getId();
            ContextEntry previous = entries.put(id, candidate);
            if (previous != null) {
                relationships.unlinkOutgoing(id);
                searchIndex.remove(id);
            }
            link(candidate, relationships);
            boolean compressedInPlace = previous != null && previous.isCompressed();
            if (candidate.isSearchable() && (!candidate.isCompressed() || compressedInPlace)) {
                searchIndex.add(id, candidate.getEntryType(), candidate.indexableText());
            }

            log.debug("[ContextStore] {} entry {} ({}, source={})",
                    previous != null ? "Replaced" : "Added", id, candidate.getEntryType(), candidate.getSource());
            return id;
        });
    }

    /**
     * Remove an entry from map, index and graph. Children and derived entries
     * are orphaned, not deleted.
     *
     * @return {@code false} if the id was not present
     */
    public boolean remove(String id) {
        if (id == null) {
            return false;
        }
        return write(() -> removeLocked(id));
    }

    /**
     * Remove an entry only if it is still expired. Used by sweeps working from
     * an older snapshot of expired ids, so an entry re-added in the meantime
     * survives.
     *
     * @return {@code false} if the id is absent or no longer expired
     */
    public boolean removeIfExpired(String id) {
        if (id == null) {
            return false;
        }
        return write(() -> {
            ContextEntry entry = entries.get(id);
            if (entry == null || !entry.isExpired(now())) {
                return false;
            }
            return removeLocked(id);
        });
    }

    /**
     * Drop the content of an entry and keep only its summary. Compressed
     * entries stay searchable through their summary. Compressing twice is a
     * no-op.
     *
     * @return copy of the compressed entry
     * @throws EntryNotFoundException
     *             if the id is not present
     */
    public ContextEntry compress(String id) {
        return write(() -> {
            ContextEntry entry = entries.get(id);
            if (entry == null) {
                throw new EntryNotFoundException(id);
            }
            if (entry.isCompressed()) {
                return entry.copy();
            }
            entry.setContent(null);
            entry.setCompressed(true);
            if (entry.isSearchable()) {
                searchIndex.add(id, entry.getEntryType(), entry.getSummary());
            }
            log.debug("[ContextStore] Compressed entry {}", id);
            return entry.copy();
        });
    }

    public void clear() {
        write(() -> {
            int size = entries.size();
            entries.clear();
            searchIndex.clear();
            relationships.clear();
            log.info("[ContextStore] Cleared {} entries", size);
            return null;
        });
    }

    // ==================== Lookups ====================

    /**
     * @return the entry, or empty when it is missing or expired
     */
    public Optional<ContextEntry> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return read(() -> {
            ContextEntry entry = entries.get(id);
            if (entry == null || entry.isExpired(now())) {
                return Optional.empty();
            }
            return Optional.of(entry.copy());
        });
    }

    /**
     * Physical presence check, independent of expiration.
     */
    public boolean contains(String id) {
        if (id == null) {
            return false;
        }
        return read(() -> entries.containsKey(id));
    }

    public List<ContextEntry> getAll() {
        return getAll(false);
    }

    public List<ContextEntry> getAll(boolean includeExpired) {
        return read(() -> {
            Instant now = now();
            List<ContextEntry> result = new ArrayList<>();
            for (ContextEntry entry : entries.values()) {
                if (includeExpired || !entry.isExpired(now)) {
                    result.add(entry.copy());
                }
            }
            return result;
        });
    }

    public List<ContextEntry> getByType(EntryType type) {
        return getByType(type, false);
    }

    public List<ContextEntry> getByType(EntryType type, boolean includeExpired) {
        return read(() -> {
            Instant now = now();
            List<ContextEntry> result = new ArrayList<>();
            for (ContextEntry entry : entries.values()) {
                if (entry.getEntryType() == type && (includeExpired || !entry.isExpired(now))) {
                    result.add(entry.copy());
                }
            }
            return result;
        });
    }

    /**
     * Number of rows physically present, expired ones included.
     */
    public int size() {
        return read(() -> entries.size());
    }

    /**
     * Snapshot of the ids whose TTL has elapsed at the time of the call.
     */
    public List<String> getExpiredIds() {
        return read(() -> {
            Instant now = now();
            List<String> expired = new ArrayList<>();
            for (ContextEntry entry : entries.values()) {
                if (entry.isExpired(now)) {
                    expired.add(entry.getId());
                }
            }
            return expired;
        });
    }

    public ContextStats getStats() {
        return read(() -> {
            Instant now = now();
            Map<EntryType, Integer> byType = new EnumMap<>(EntryType.class);
            int total = 0;
            int compressed = 0;
            int expiredPending = 0;
            for (ContextEntry entry : entries.values()) {
                if (entry.isExpired(now)) {
                    expiredPending++;
                    continue;
                }
                total++;
                byType.merge(entry.getEntryType(), 1, Integer::sum);
                if (entry.isCompressed()) {
                    compressed++;
                }
            }
            return ContextStats.builder()
                    .total(total)
                    .byType(byType)
                    .compressed(compressed)
                    .indexed(searchIndex.size())
                    .expiredPending(expiredPending)
                    .build();
        });
    }

    // ==================== Search ====================

    public List<ContextSearchResult> search(String query) {
        return search(query, VectorSearchIndex.DEFAULT_LIMIT);
    }

    public List<ContextSearchResult> search(String query, int limit) {
        return search(query, limit, null, null, false);
    }

    /**
     * Rank live, searchable entries against the query. Expired and
     * non-searchable entries are dropped before {@code limit} is applied, so
     * fewer than {@code limit} results may come back. Never throws.
     *
     * @param types
     *            optional entry type filter
     * @param minScore
     *            optional lower bound on the cosine score
     * @param includeContent
     *            whether results carry full content
     */
    public List<ContextSearchResult> search(String query, int limit, Set<EntryType> types, Double minScore,
            boolean includeContent) {
        if (limit <= 0) {
            return List.of();
        }
        try {
            return read(() -> {
                Instant now = now();
                List<ContextSearchResult> results = new ArrayList<>();
                for (SearchHit hit : searchIndex.search(query, Integer.MAX_VALUE, minScore, types)) {
                    ContextEntry entry = entries.get(hit.getEntryId());
                    if (entry == null || !entry.isSearchable() || entry.isExpired(now)) {
                        continue;
                    }
                    results.add(toSearchResult(entry, hit.getScore(), includeContent));
                    if (results.size() >= limit) {
                        break;
                    }
                }
                return results;
            });
        } catch (RuntimeException e) {
            log.warn("[ContextStore] Search for '{}' failed, returning no results", query, e);
            return List.of();
        }
    }

    // ==================== Relationships ====================

    public List<String> getChildren(String id) {
        return read(() -> relationships.getChildren(id));
    }

    public Optional<String> getParent(String id) {
        return read(() -> relationships.getParent(id));
    }

    public List<String> getAncestors(String id) {
        return read(() -> relationships.getAncestors(id));
    }

    public List<String> getDescendants(String id) {
        return read(() -> relationships.getDescendants(id));
    }

    public List<String> getSourceEntries(String id) {
        return read(() -> relationships.getSourceEntries(id));
    }

    public List<String> getDerivedEntries(String id) {
        return read(() -> relationships.getDerivedEntries(id));
    }

    public List<String> getDerivationChain(String id) {
        return read(() -> relationships.getDerivationChain(id));
    }

    public List<String> getImpactScope(String id) {
        return read(() -> relationships.getImpactScope(id));
    }

    // ==================== Snapshots ====================

    /**
     * Serialize every physically present entry, expired ones included.
     */
    public Map<String, Map<String, Object>> exportToDict() {
        return read(() -> snapshotCodec.toSnapshot(entries.values()));
    }

    public String exportToJson() {
        return snapshotCodec.toJson(exportToDict());
    }

    /**
     * Replace the store contents with a snapshot produced by
     * {@link #exportToDict()}.
     *
     * <p>
     * References to ids absent from the snapshot are kept on the entries (they
     * were orphaned before export) but not linked. Every searchable entry is
     * indexed, compressed ones through their summary, as after
     * {@link #compress(String)}. The swap is atomic: if any
     * entry is malformed or the snapshot holds a cycle, the current contents
     * stay as they were.
     *
     * @return number of restored entries
     */
    public int deserialize(Map<String, Map<String, Object>> snapshot) {
        List<ContextEntry> restored = snapshotCodec.fromSnapshot(snapshot);
        return write(() -> {
            Map<String, ContextEntry> restoredEntries = new LinkedHashMap<>();
            for (ContextEntry entry : restored) {
                ContextEntryValidator.validate(entry);
                restoredEntries.put(entry.getId(), entry.copy());
            }

            RelationshipGraph restoredGraph = new RelationshipGraph();
            VectorSearchIndex restoredIndex = new VectorSearchIndex();
            for (ContextEntry entry : restoredEntries.values()) {
                String id = entry.getId();
                if (entry.getParentId() != null && restoredEntries.containsKey(entry.getParentId())) {
                    restoredGraph.linkParent(id, entry.getParentId());
                }
                List<String> sources = new ArrayList<>();
                for (String sourceId : entry.getDerivedFrom()) {
                    if (restoredEntries.containsKey(sourceId)) {
                        sources.add(sourceId);
                    }
                }
                restoredGraph.linkDerivation(id, sources);
                if (entry.isSearchable()) {
                    restoredIndex.add(id, entry.getEntryType(), entry.indexableText());
                }
            }

            entries = restoredEntries;
            relationships = restoredGraph;
            searchIndex = restoredIndex;
            log.info("[ContextStore] Restored {} entries from snapshot", restoredEntries.size());
            return restoredEntries.size();
        });
    }

    public int importFromJson(String json) {
        return deserialize(snapshotCodec.fromJson(json));
    }

    // ==================== Internals ====================

    private ContextEntry prepare(ContextEntry entry) {
        if (entry == null) {
            return null;
        }
        ContextEntry candidate = entry.copy();
        if (candidate.getId() == null) {
            candidate.setId(generateUniqueId());
        }
        if (candidate.getCreatedAt() == null) {
            candidate.setCreatedAt(now().truncatedTo(ChronoUnit.MILLIS));
        }
        if (candidate.getParentId() != null && candidate.getParentId().isBlank()) {
            candidate.setParentId(null);
        }
        return candidate;
    }

    private void mergeIntoExisting(ContextEntry candidate, ContextEntry existing) {
        String id = candidate.getId();
        if (!Objects.equals(candidate.getParentId(), existing.getParentId())) {
            throw RelationshipException.immutable(id, candidate.getParentId(), "parentId");
        }
        if (!new LinkedHashSet<>(candidate.getDerivedFrom()).equals(new LinkedHashSet<>(existing.getDerivedFrom()))) {
            throw RelationshipException.immutable(id, null, "derivedFrom");
        }
        if (existing.isCompressed()) {
            candidate.setContent(null);
            candidate.setCompressed(true);
        }
    }

    private boolean removeLocked(String id) {
        ContextEntry removed = entries.remove(id);
        if (removed == null) {
            return false;
        }
        searchIndex.remove(id);
        relationships.unlink(id);
        log.debug("[ContextStore] Removed entry {}", id);
        return true;
    }

    private String generateUniqueId() {
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            String id = ContextIdSupport.generate();
            if (!entries.containsKey(id)) {
                return id;
            }
        }
        throw new IllegalStateException("Could not generate a unique context entry id");
    }

    private void validateRelationships(ContextEntry candidate, Map<String, ContextEntry> present) {
        String id = candidate.getId();
        String parentId = candidate.getParentId();
        if (parentId != null) {
            if (!present.containsKey(parentId)) {
                throw RelationshipException.dangling(id, parentId, "parentId");
            }
            relationships.checkParentLink(id, parentId);
        }
        for (String sourceId : candidate.getDerivedFrom()) {
            if (!present.containsKey(sourceId)) {
                throw RelationshipException.dangling(id, sourceId, "derivedFrom");
            }
        }
        relationships.checkDerivationLink(id, candidate.getDerivedFrom());
    }

    private void link(ContextEntry entry, RelationshipGraph graph) {
        if (entry.getParentId() != null) {
            graph.linkParent(entry.getId(), entry.getParentId());
        }
        graph.linkDerivation(entry.getId(), entry.getDerivedFrom());
    }

    private ContextSearchResult toSearchResult(ContextEntry entry, double score, boolean includeContent) {
        return ContextSearchResult.builder()
                .entryId(entry.getId())
                .entryType(entry.getEntryType())
                .source(entry.getSource())
                .summary(entry.getSummary())
                .content(includeContent ? entry.getContent() : null)
                .score(score)
                .references(new ArrayList<>(entry.getReferences()))
                .parentId(entry.getParentId())
                .compressed(entry.isCompressed())
                .build();
    }

    private Instant now() {
        return Instant.now(clock);
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
