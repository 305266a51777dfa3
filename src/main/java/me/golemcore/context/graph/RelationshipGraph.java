package me.golemcore.context.graph;

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
import me.golemcore.context.domain.exception.RelationshipException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Two directed acyclic graphs over entry ids: parentage (parent to children)
 * and derivation (source to derived entries).
 *
 * <p>
 * Edges are adjacency maps keyed by id; the store's entry map is the only
 * owner of the entries themselves. Every new edge is checked by walking the
 * ancestors of its target before it is committed, so neither graph can ever
 * contain a cycle.
 *
 * <p>
 * Removing a node orphans its children and derived entries: their edges to the
 * removed node disappear but the nodes stay.
 *
 * <p>
 * Not thread-safe. The owning {@code ContextStore} serializes access.
 *
 * @since 1.0
 */
@Slf4j
public class RelationshipGraph {

    private static final String PARENT_GRAPH = "parent";
    private static final String DERIVATION_GRAPH = "derivation";

    private final Map<String, String> parentOf = new HashMap<>();
    private final Map<String, Set<String>> childrenOf = new HashMap<>();
    private final Map<String, Set<String>> sourcesOf = new HashMap<>();
    private final Map<String, Set<String>> derivedOf = new HashMap<>();

    // ==================== Linking ====================

    /**
     * Verify that {@code childId -> parentId} can be added without a cycle.
     *
     * @throws RelationshipException
     *             if the child is the parent itself or one of its ancestors
     */
    public void checkParentLink(String childId, String parentId) {
        if (childId.equals(parentId)) {
            throw RelationshipException.cycle(childId, parentId, PARENT_GRAPH);
        }
        String current = parentId;
        Set<String> visited = new HashSet<>();
        while (current != null && visited.add(current)) {
            if (current.equals(childId)) {
                throw RelationshipException.cycle(childId, parentId, PARENT_GRAPH);
            }
            current = parentOf.get(current);
        }
    }

    public void linkParent(String childId, String parentId) {
        checkParentLink(childId, parentId);
        String previous = parentOf.put(childId, parentId);
        if (previous != null && !previous.equals(parentId)) {
            removeFromSet(childrenOf, previous, childId);
        }
        childrenOf.computeIfAbsent(parentId, key -> new LinkedHashSet<>()).add(childId);
        log.trace("[RelationshipGraph] {} -> parent {}", childId, parentId);
    }

    /**
     * Verify that every {@code derivedId <- sourceId} edge can be added without
     * a cycle.
     *
     * @throws RelationshipException
     *             on the first source that would close a cycle
     */
    public void checkDerivationLink(String derivedId, Collection<String> sourceIds) {
        for (String sourceId : sourceIds) {
            if (derivedId.equals(sourceId) || collectUpstream(sourceId).contains(derivedId)) {
                throw RelationshipException.cycle(derivedId, sourceId, DERIVATION_GRAPH);
            }
        }
    }

    /**
     * Record derivation edges. Either all edges are added or none is.
     */
    public void linkDerivation(String derivedId, Collection<String> sourceIds) {
        if (sourceIds == null || sourceIds.isEmpty()) {
            return;
        }
        checkDerivationLink(derivedId, sourceIds);
        Set<String> sources = sourcesOf.computeIfAbsent(derivedId, key -> new LinkedHashSet<>());
        for (String sourceId : sourceIds) {
            sources.add(sourceId);
            derivedOf.computeIfAbsent(sourceId, key -> new LinkedHashSet<>()).add(derivedId);
        }
        log.trace("[RelationshipGraph] {} derived from {}", derivedId, sourceIds);
    }

    /**
     * Remove every edge touching {@code id}. Children and derived entries are
     * orphaned, never deleted.
     */
    public void unlink(String id) {
        unlinkOutgoing(id);

        Set<String> children = childrenOf.remove(id);
        if (children != null) {
            for (String child : children) {
                parentOf.remove(child);
            }
            log.debug("[RelationshipGraph] Orphaned {} children of {}", children.size(), id);
        }

        Set<String> derived = derivedOf.remove(id);
        if (derived != null) {
            for (String derivedId : derived) {
                removeFromSet(sourcesOf, derivedId, id);
            }
        }
    }

    /**
     * Remove only the edges owned by {@code id}: its own parent link and its
     * own derivation sources. Incoming edges from children stay.
     */
    public void unlinkOutgoing(String id) {
        String parent = parentOf.remove(id);
        if (parent != null) {
            removeFromSet(childrenOf, parent, id);
        }
        Set<String> sources = sourcesOf.remove(id);
        if (sources != null) {
            for (String sourceId : sources) {
                removeFromSet(derivedOf, sourceId, id);
            }
        }
    }

    public void clear() {
        parentOf.clear();
        childrenOf.clear();
        sourcesOf.clear();
        derivedOf.clear();
    }

    // ==================== Parentage queries ====================

    public Optional<String> getParent(String id) {
        return Optional.ofNullable(parentOf.get(id));
    }

    public List<String> getChildren(String id) {
        return new ArrayList<>(childrenOf.getOrDefault(id, Set.of()));
    }

    /**
     * Full parent chain, nearest ancestor first.
     */
    public List<String> getAncestors(String id) {
        List<String> ancestors = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(id);
        String current = parentOf.get(id);
        while (current != null && visited.add(current)) {
            ancestors.add(current);
            current = parentOf.get(current);
        }
        return ancestors;
    }

    /**
     * Everything that hangs off {@code id}, depth-first: children (and their
     * subtrees) first, then entries derived from it. Each id appears once.
     */
    public List<String> getDescendants(String id) {
        List<String> descendants = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(id);
        Deque<String> stack = new ArrayDeque<>();
        pushReversed(stack, downstreamOf(id));
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            descendants.add(current);
            pushReversed(stack, downstreamOf(current));
        }
        return descendants;
    }

    // ==================== Derivation queries ====================

    public List<String> getSourceEntries(String id) {
        return new ArrayList<>(sourcesOf.getOrDefault(id, Set.of()));
    }

    public List<String> getDerivedEntries(String id) {
        return new ArrayList<>(derivedOf.getOrDefault(id, Set.of()));
    }

    /**
     * Transitive set of entries {@code id} was derived from, breadth-first.
     */
    public List<String> getDerivationChain(String id) {
        return new ArrayList<>(collectUpstream(id));
    }

    /**
     * Transitive set of entries derived from {@code id}, breadth-first.
     */
    public List<String> getImpactScope(String id) {
        return new ArrayList<>(collectTransitive(id, derivedOf));
    }

    public int parentEdgeCount() {
        return parentOf.size();
    }

    public int derivationEdgeCount() {
        int count = 0;
        for (Set<String> sources : sourcesOf.values()) {
            count += sources.size();
        }
        return count;
    }

    private Set<String> collectUpstream(String id) {
        return collectTransitive(id, sourcesOf);
    }

    private Set<String> collectTransitive(String id, Map<String, Set<String>> edges) {
        Set<String> result = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(edges.getOrDefault(id, Set.of()));
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(id) || !result.add(current)) {
                continue;
            }
            queue.addAll(edges.getOrDefault(current, Set.of()));
        }
        return result;
    }

    private List<String> downstreamOf(String id) {
        List<String> downstream = new ArrayList<>(childrenOf.getOrDefault(id, Set.of()));
        downstream.addAll(derivedOf.getOrDefault(id, Set.of()));
        return downstream;
    }

    private static void pushReversed(Deque<String> stack, List<String> ids) {
        for (int i = ids.size() - 1; i >= 0; i--) {
            stack.push(ids.get(i));
        }
    }

    private static void removeFromSet(Map<String, Set<String>> edges, String key, String value) {
        Set<String> values = edges.get(key);
        if (values == null) {
            return;
        }
        values.remove(value);
        if (values.isEmpty()) {
            edges.remove(key);
        }
    }
}
