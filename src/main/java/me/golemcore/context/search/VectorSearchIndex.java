package me.golemcore.context.search;

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
import me.golemcore.context.domain.model.EntryType;
import me.golemcore.context.domain.model.SearchHit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lexical search index using TF-IDF weighting and cosine similarity.
 *
 * <p>
 * Every document is kept as a sparse term-count map. Weights are
 * {@code tf * idf} with {@code idf = log(totalDocuments / documentFrequency)}.
 * Because the document total changes on every add or remove, all IDF values and
 * document norms are invalidated on mutation and recomputed lazily before the
 * next search.
 *
 * <p>
 * The index never throws for malformed input: blank queries, unknown terms and
 * an empty corpus all produce an empty result. Documents scoring zero are not
 * matches and are never returned. A term present in every document has an IDF
 * of zero, so it matches nothing; in a single-document corpus no query matches,
 * not even the document's exact text.
 *
 * <p>
 * Mutations are not thread-safe; the owning {@code ContextStore} serializes
 * them. Concurrent searches are safe because the lazy weight refresh is
 * synchronized.
 *
 * @since 1.0
 */
@Slf4j
public class VectorSearchIndex {

    public static final int DEFAULT_LIMIT = 10;

    private static final Pattern PUNCTUATION = Pattern.compile("[\\p{Punct}\\p{IsPunctuation}]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Map<String, Map<String, Integer>> termCounts = new HashMap<>();
    private final Map<String, EntryType> entryTypes = new HashMap<>();
    private final Map<String, Integer> documentFrequency = new HashMap<>();

    private final Map<String, Double> idfCache = new HashMap<>();
    private final Map<String, Double> documentNorms = new HashMap<>();
    private boolean weightsStale = true;

    /**
     * Lowercase, strip punctuation, split on whitespace and drop empty tokens.
     */
    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        String stripped = PUNCTUATION.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("");
        for (String token : WHITESPACE.split(stripped)) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public void add(String entryId, String text) {
        add(entryId, null, text);
    }

    /**
     * Index a document, replacing any previous version with the same id.
     */
    public void add(String entryId, EntryType entryType, String text) {
        if (entryId == null) {
            return;
        }
        if (termCounts.containsKey(entryId)) {
            remove(entryId);
        }

        Map<String, Integer> counts = countTerms(tokenize(text));
        termCounts.put(entryId, counts);
        if (entryType != null) {
            entryTypes.put(entryId, entryType);
        }
        for (String term : counts.keySet()) {
            documentFrequency.merge(term, 1, Integer::sum);
        }
        weightsStale = true;
        log.trace("[SearchIndex] Indexed {} ({} distinct terms)", entryId, counts.size());
    }

    /**
     * Drop a document and decrement the document frequency of its terms.
     *
     * @return {@code true} if the document was indexed
     */
    public boolean remove(String entryId) {
        Map<String, Integer> counts = termCounts.remove(entryId);
        if (counts == null) {
            return false;
        }
        entryTypes.remove(entryId);
        for (String term : counts.keySet()) {
            documentFrequency.computeIfPresent(term, (key, df) -> df > 1 ? df - 1 : null);
        }
        weightsStale = true;
        return true;
    }

    public boolean contains(String entryId) {
        return termCounts.containsKey(entryId);
    }

    public int size() {
        return termCounts.size();
    }

    public int vocabularySize() {
        return documentFrequency.size();
    }

    /**
     * Current IDF of a term, {@code 0.0} for terms absent from the corpus.
     */
    public double idf(String term) {
        if (term == null) {
            return 0.0;
        }
        refreshWeights();
        return idfCache.getOrDefault(term.toLowerCase(Locale.ROOT), 0.0);
    }

    public void clear() {
        termCounts.clear();
        entryTypes.clear();
        documentFrequency.clear();
        idfCache.clear();
        documentNorms.clear();
        weightsStale = true;
    }

    public List<SearchHit> search(String query) {
        return search(query, DEFAULT_LIMIT, null, null);
    }

    public List<SearchHit> search(String query, int limit) {
        return search(query, limit, null, null);
    }

    /**
     * Rank indexed documents by cosine similarity to the query.
     *
     * @param query
     *            free text query
     * @param limit
     *            maximum number of hits
     * @param minScore
     *            optional lower bound on the score, {@code null} for none
     * @param types
     *            optional entry type filter, {@code null} or empty for all
     * @return hits sorted by score descending, ties broken by ascending id
     */
    public List<SearchHit> search(String query, int limit, Double minScore, Set<EntryType> types) {
        if (limit <= 0 || termCounts.isEmpty()) {
            return List.of();
        }
        List<String> queryTokens = tokenize(query);
        if (queryTokens.isEmpty()) {
            return List.of();
        }

        refreshWeights();

        Map<String, Double> queryVector = new HashMap<>();
        for (Map.Entry<String, Integer> term : countTerms(queryTokens).entrySet()) {
            double idf = idfCache.getOrDefault(term.getKey(), 0.0);
            if (idf > 0.0) {
                queryVector.put(term.getKey(), term.getValue() * idf);
            }
        }
        double queryNorm = norm(queryVector.values());
        if (queryNorm == 0.0) {
            return List.of();
        }

        List<SearchHit> hits = new ArrayList<>();
        for (Map.Entry<String, Map<String, Integer>> document : termCounts.entrySet()) {
            String entryId = document.getKey();
            EntryType entryType = entryTypes.get(entryId);
            if (types != null && !types.isEmpty() && !types.contains(entryType)) {
                continue;
            }
            double score = cosine(queryVector, queryNorm, document.getValue(), documentNorms.get(entryId));
            if (score <= 0.0 || (minScore != null && score < minScore)) {
                continue;
            }
            hits.add(SearchHit.builder()
                    .entryId(entryId)
                    .entryType(entryType)
                    .score(score)
                    .build());
        }

        hits.sort(Comparator.comparingDouble(SearchHit::getScore).reversed()
                .thenComparing(SearchHit::getEntryId));
        List<SearchHit> result = hits.size() > limit ? new ArrayList<>(hits.subList(0, limit)) : hits;
        log.debug("[SearchIndex] Query '{}' matched {} of {} documents, returning {}",
                query, hits.size(), termCounts.size(), result.size());
        return result;
    }

    private double cosine(Map<String, Double> queryVector, double queryNorm,
            Map<String, Integer> documentTerms, Double documentNorm) {
        if (documentNorm == null || documentNorm == 0.0) {
            return 0.0;
        }
        double dot = 0.0;
        for (Map.Entry<String, Double> term : queryVector.entrySet()) {
            Integer tf = documentTerms.get(term.getKey());
            if (tf != null) {
                dot += term.getValue() * tf * idfCache.getOrDefault(term.getKey(), 0.0);
            }
        }
        return dot / (queryNorm * documentNorm);
    }

    private synchronized void refreshWeights() {
        if (!weightsStale) {
            return;
        }
        idfCache.clear();
        documentNorms.clear();

        double totalDocuments = termCounts.size();
        for (Map.Entry<String, Integer> term : documentFrequency.entrySet()) {
            idfCache.put(term.getKey(), Math.log(totalDocuments / term.getValue()));
        }
        for (Map.Entry<String, Map<String, Integer>> document : termCounts.entrySet()) {
            double sumOfSquares = 0.0;
            for (Map.Entry<String, Integer> term : document.getValue().entrySet()) {
                double weight = term.getValue() * idfCache.getOrDefault(term.getKey(), 0.0);
                sumOfSquares += weight * weight;
            }
            documentNorms.put(document.getKey(), Math.sqrt(sumOfSquares));
        }
        weightsStale = false;
    }

    private static Map<String, Integer> countTerms(List<String> tokens) {
        Map<String, Integer> counts = new HashMap<>();
        for (String token : tokens) {
            counts.merge(token, 1, Integer::sum);
        }
        return counts;
    }

    private static double norm(Iterable<Double> weights) {
        double sumOfSquares = 0.0;
        for (double weight : weights) {
            sumOfSquares += weight * weight;
        }
        return Math.sqrt(sumOfSquares);
    }
}
