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
import me.golemcore.context.domain.exception.EntryBoundsException;
import me.golemcore.context.domain.exception.EntryNotFoundException;
import me.golemcore.context.domain.model.AllocationStats;
import me.golemcore.context.domain.model.ContextAllocation;
import me.golemcore.context.domain.model.ContextEntry;
import me.golemcore.context.domain.model.ContextEntryView;
import me.golemcore.context.domain.model.EntryType;
import me.golemcore.context.domain.model.ImplementationContext;
import me.golemcore.context.domain.model.ImplementationEntryView;
import me.golemcore.context.domain.model.WorkingContext;
import me.golemcore.context.infrastructure.config.ContextEngineProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Produces the views of the context store that are actually sent to LLM
 * calls.
 *
 * <p>
 * Two policies:
 * <ul>
 * <li><b>Working context</b> - summary and metadata only, no content, no bound
 * on the number of entries</li>
 * <li><b>Implementation context</b> - full content for the requested entries
 * plus their transitive parents and derivation sources. The resolved closure
 * must hold fewer than {@code context.budget.max-implementation-entries}
 * (default 200) entries or the request fails before anything is
 * materialized.</li>
 * </ul>
 *
 * <p>
 * Every implementation context is tracked as an outstanding allocation until
 * its context id is released. Releasing only retires the handle; entries are
 * never deleted by the allocator.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ContextBudgetAllocator {

    private final ContextStore contextStore;
    private final ContextEngineProperties properties;
    private final Clock clock;

    private final Map<String, ContextAllocation> outstanding = new ConcurrentHashMap<>();
    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong totalReleases = new AtomicLong();
    private final AtomicLong entriesServed = new AtomicLong();

    public ContextBudgetAllocator(ContextStore contextStore, ContextEngineProperties properties, Clock clock) {
        this.contextStore = contextStore;
        this.properties = properties;
        this.clock = clock;
    }

    public int getMaxEntries() {
        return properties.getBudget().getMaxImplementationEntries();
    }

    public boolean isWithinBounds(int entryCount) {
        return entryCount < getMaxEntries();
    }

    // ==================== Working context ====================

    public WorkingContext buildWorkingContext() {
        return buildWorkingContext(null, false);
    }

    /**
     * Summary-only view of the live store, ordered by creation time then id.
     *
     * @param types
     *            optional entry type filter, {@code null} or empty for all
     * @param includeNonSearchable
     *            whether entries excluded from search are listed too
     */
    public WorkingContext buildWorkingContext(Set<EntryType> types, boolean includeNonSearchable) {
        List<ContextEntryView> views = new ArrayList<>();
        int summaryTokens = 0;

        List<ContextEntry> entries = new ArrayList<>(contextStore.getAll());
        entries.sort(Comparator.comparing(ContextEntry::getCreatedAt)
                .thenComparing(ContextEntry::getId));
        for (ContextEntry entry : entries) {
            if (types != null && !types.isEmpty() && !types.contains(entry.getEntryType())) {
                continue;
            }
            if (!includeNonSearchable && !entry.isSearchable()) {
                continue;
            }
            views.add(ContextEntryView.builder()
                    .id(entry.getId())
                    .entryType(entry.getEntryType())
                    .source(entry.getSource())
                    .summary(entry.getSummary())
                    .createdAt(entry.getCreatedAt())
                    .references(new ArrayList<>(entry.getReferences()))
                    .parentId(entry.getParentId())
                    .compressed(entry.isCompressed())
                    .build());
            summaryTokens += estimateTokens(entry.getSummary());
        }

        return WorkingContext.builder()
                .entries(views)
                .totalCount(views.size())
                .summaryTokens(summaryTokens)
                .build();
    }

    // ==================== Implementation context ====================

    /**
     * Resolve the requested ids plus their transitive parents and derivation
     * sources. Requested ids come first in request order, dependencies follow
     * in discovery order. Expired dependencies are skipped.
     *
     * @throws EntryNotFoundException
     *             if a requested id is missing or expired
     */
    public List<String> resolveClosure(Collection<String> entryIds) {
        return new ArrayList<>(resolveClosureEntries(entryIds).keySet());
    }

    /**
     * Materialize a bounded, full-content context and track it as outstanding.
     *
     * @throws EntryBoundsException
     *             if the resolved closure reaches the entry limit
     * @throws EntryNotFoundException
     *             if a requested id is missing or expired
     */
    public ImplementationContext requestContext(Collection<String> entryIds) {
        Map<String, ContextEntry> closure = resolveClosureEntries(entryIds);
        if (!isWithinBounds(closure.size())) {
            log.warn("[ContextBudget] Rejected request: {} entries resolved, limit {}",
                    closure.size(), getMaxEntries());
            throw new EntryBoundsException(closure.size(), getMaxEntries());
        }

        List<ImplementationEntryView> views = new ArrayList<>(closure.size());
        int totalTokens = 0;
        for (ContextEntry entry : closure.values()) {
            views.add(toImplementationView(entry));
            totalTokens += estimateTokens(entry.indexableText());
        }

        String contextId = "impl_" + UUID.randomUUID();
        Instant allocatedAt = Instant.now(clock);
        List<String> resolvedIds = new ArrayList<>(closure.keySet());
        outstanding.put(contextId, ContextAllocation.builder()
                .contextId(contextId)
                .entryIds(resolvedIds)
                .allocatedAt(allocatedAt)
                .build());
        totalRequests.incrementAndGet();
        entriesServed.addAndGet(resolvedIds.size());

        log.debug("[ContextBudget] Allocated {} with {} entries (~{} tokens)",
                contextId, resolvedIds.size(), totalTokens);
        return ImplementationContext.builder()
                .contextId(contextId)
                .requestedIds(entryIds != null ? new ArrayList<>(new LinkedHashSet<>(entryIds)) : new ArrayList<>())
                .entryIds(new ArrayList<>(resolvedIds))
                .entries(views)
                .entryCount(views.size())
                .totalTokens(totalTokens)
                .allocatedAt(allocatedAt)
                .build();
    }

    /**
     * Retire an allocation handle. Underlying entries are untouched.
     *
     * @return {@code true} if the handle was outstanding
     */
    public boolean releaseContext(String contextId) {
        if (contextId == null) {
            return false;
        }
        ContextAllocation allocation = outstanding.remove(contextId);
        if (allocation == null) {
            log.debug("[ContextBudget] Release of unknown or already released context {}", contextId);
            return false;
        }
        totalReleases.incrementAndGet();
        log.debug("[ContextBudget] Released {}", contextId);
        return true;
    }

    /**
     * Request a context, run the handler and always release the context, even
     * when the handler throws.
     */
    public <T> T withContext(Collection<String> entryIds, Function<ImplementationContext, T> handler) {
        ImplementationContext context = requestContext(entryIds);
        try {
            return handler.apply(context);
        } finally {
            releaseContext(context.getContextId());
        }
    }

    /**
     * Split a flat id list into chunks that each stay below the entry limit.
     * Dependencies are not taken into account here.
     */
    public List<List<String>> splitIntoBatches(List<String> entryIds) {
        List<List<String>> batches = new ArrayList<>();
        if (entryIds == null || entryIds.isEmpty()) {
            return batches;
        }
        int chunkSize = Math.max(1, getMaxEntries() - 1);
        for (int i = 0; i < entryIds.size(); i += chunkSize) {
            batches.add(new ArrayList<>(entryIds.subList(i, Math.min(entryIds.size(), i + chunkSize))));
        }
        return batches;
    }

    // ==================== Bookkeeping ====================

    /**
     * Copies of the outstanding allocations, oldest first.
     */
    public List<ContextAllocation> getOutstandingAllocations() {
        List<ContextAllocation> allocations = new ArrayList<>();
        for (ContextAllocation allocation : outstanding.values()) {
            allocations.add(allocation.copy());
        }
        allocations.sort(Comparator.comparing(ContextAllocation::getAllocatedAt)
                .thenComparing(ContextAllocation::getContextId));
        return allocations;
    }

    public Optional<ContextAllocation> getAllocation(String contextId) {
        if (contextId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(outstanding.get(contextId)).map(ContextAllocation::copy);
    }

    public boolean isInUse(String entryId) {
        for (ContextAllocation allocation : outstanding.values()) {
            if (allocation.getEntryIds().contains(entryId)) {
                return true;
            }
        }
        return false;
    }

    public AllocationStats getUsageStats() {
        return AllocationStats.builder()
                .outstanding(outstanding.size())
                .totalRequests(totalRequests.get())
                .totalReleases(totalReleases.get())
                .entriesServed(entriesServed.get())
                .build();
    }

    public List<ContextAllocation> findLeakedAllocations() {
        return findLeakedAllocations(Duration.ofMillis(properties.getBudget().getLeakThresholdMs()));
    }

    /**
     * Outstanding allocations held longer than {@code maxAge}.
     */
    public List<ContextAllocation> findLeakedAllocations(Duration maxAge) {
        Instant threshold = Instant.now(clock).minus(maxAge);
        List<ContextAllocation> leaked = new ArrayList<>();
        for (ContextAllocation allocation : getOutstandingAllocations()) {
            if (allocation.getAllocatedAt().isBefore(threshold)) {
                leaked.add(allocation);
            }
        }
        if (!leaked.isEmpty()) {
            log.warn("[ContextBudget] {} allocation(s) outstanding for more than {}ms: {}",
                    leaked.size(), maxAge.toMillis(),
                    leaked.stream().map(ContextAllocation::getContextId).toList());
        }
        return leaked;
    }

    // ==================== Internals ====================

    private Map<String, ContextEntry> resolveClosureEntries(Collection<String> entryIds) {
        Map<String, ContextEntry> closure = new LinkedHashMap<>();
        if (entryIds == null) {
            return closure;
        }
        for (String entryId : entryIds) {
            if (closure.containsKey(entryId)) {
                continue;
            }
            ContextEntry entry = contextStore.get(entryId)
                    .orElseThrow(() -> new EntryNotFoundException(entryId));
            closure.put(entryId, entry);
        }

        Deque<String> pending = new ArrayDeque<>(closure.keySet());
        while (!pending.isEmpty()) {
            String current = pending.poll();
            List<String> dependencies = new ArrayList<>();
            contextStore.getParent(current).ifPresent(dependencies::add);
            dependencies.addAll(contextStore.getSourceEntries(current));
            for (String dependencyId : dependencies) {
                if (closure.containsKey(dependencyId)) {
                    continue;
                }
                Optional<ContextEntry> dependency = contextStore.get(dependencyId);
                if (dependency.isPresent()) {
                    closure.put(dependencyId, dependency.get());
                    pending.add(dependencyId);
                }
            }
        }
        return closure;
    }

    private ImplementationEntryView toImplementationView(ContextEntry entry) {
        return ImplementationEntryView.builder()
                .id(entry.getId())
                .entryType(entry.getEntryType())
                .source(entry.getSource())
                .summary(entry.getSummary())
                .content(entry.getContent())
                .createdAt(entry.getCreatedAt())
                .references(new ArrayList<>(entry.getReferences()))
                .parentId(entry.getParentId())
                .derivedFrom(new ArrayList<>(entry.getDerivedFrom()))
                .compressed(entry.isCompressed())
                .build();
    }

    private int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return text.length() / Math.max(1, properties.getBudget().getCharsPerToken());
    }
}
