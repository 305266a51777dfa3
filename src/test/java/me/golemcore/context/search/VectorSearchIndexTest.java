package me.golemcore.context.search;

import me.golemcore.context.domain.model.EntryType;
import me.golemcore.context.domain.model.SearchHit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VectorSearchIndexTest {

    private static final String CAT = "ctx_cat00001";
    private static final String DOG = "ctx_dog00001";
    private static final String BIRD = "ctx_bird0001";

    private VectorSearchIndex index;

    @BeforeEach
    void setUp() {
        index = new VectorSearchIndex();
    }

    // ==================== Tokenization ====================

    @Test
    void shouldLowercaseStripPunctuationAndSplit() {
        assertEquals(List.of("hello", "world", "its", "fine"),
                VectorSearchIndex.tokenize("Hello, World!  It's\tfine."));
    }

    @Test
    void shouldReturnNoTokensForBlankText() {
        assertTrue(VectorSearchIndex.tokenize(null).isEmpty());
        assertTrue(VectorSearchIndex.tokenize("   ").isEmpty());
        assertTrue(VectorSearchIndex.tokenize("?!,.").isEmpty());
    }

    // ==================== Ranking ====================

    @Test
    void shouldRankMatchingDocumentAboveOthers() {
        index.add(CAT, "the cat sat");
        index.add(DOG, "the dog sat");

        List<SearchHit> hits = index.search("cat");

        assertFalse(hits.isEmpty());
        assertEquals(CAT, hits.get(0).getEntryId());
        double dogScore = hits.stream()
                .filter(hit -> hit.getEntryId().equals(DOG))
                .mapToDouble(SearchHit::getScore)
                .findFirst()
                .orElse(0.0);
        assertTrue(hits.get(0).getScore() > dogScore);
    }

    @Test
    void shouldReturnIdenticalOrderingForRepeatedQueries() {
        index.add(CAT, "the cat sat on the mat");
        index.add(DOG, "the dog sat on the cat");
        index.add(BIRD, "a bird flew over the dog");

        List<SearchHit> first = index.search("cat dog");
        List<SearchHit> second = index.search("cat dog");

        assertEquals(first, second);
    }

    @Test
    void shouldBreakScoreTiesByAscendingId() {
        index.add("ctx_bbbbbbbb", "alpha beta");
        index.add("ctx_aaaaaaaa", "alpha beta");
        index.add("ctx_cccccccc", "gamma delta");

        List<SearchHit> hits = index.search("alpha");

        assertEquals(2, hits.size());
        assertEquals("ctx_aaaaaaaa", hits.get(0).getEntryId());
        assertEquals("ctx_bbbbbbbb", hits.get(1).getEntryId());
        assertEquals(hits.get(0).getScore(), hits.get(1).getScore(), 1e-12);
    }

    @Test
    void shouldScoreIdenticalDocumentAtOne() {
        index.add(CAT, "cat");
        index.add(DOG, "dog");

        List<SearchHit> hits = index.search("cat");

        assertEquals(1, hits.size());
        assertEquals(1.0, hits.get(0).getScore(), 1e-9);
    }

    @Test
    void shouldIgnoreTermsPresentInEveryDocument() {
        index.add(CAT, "the cat sat");
        index.add(DOG, "the dog sat");

        assertEquals(0.0, index.idf("the"), 1e-12);
        assertTrue(index.search("the sat").isEmpty());
    }

    @Test
    void shouldReturnNothingForSingleDocumentCorpus() {
        index.add(CAT, "the cat sat");

        assertTrue(index.search("cat").isEmpty());
    }

    @Test
    void shouldReturnNothingForEmptyOrUnknownQuery() {
        index.add(CAT, "the cat sat");
        index.add(DOG, "the dog sat");

        assertTrue(index.search("").isEmpty());
        assertTrue(index.search(null).isEmpty());
        assertTrue(index.search("unicorn").isEmpty());
        assertTrue(index.search("cat", 0).isEmpty());
    }

    @Test
    void shouldHonourLimit() {
        index.add("ctx_00000001", "shared term one");
        index.add("ctx_00000002", "shared term two");
        index.add("ctx_00000003", "shared term three");
        index.add("ctx_00000004", "other words");

        assertEquals(2, index.search("shared", 2).size());
    }

    @Test
    void shouldFilterByMinScoreAndType() {
        index.add(CAT, EntryType.FILE, "cat");
        index.add(DOG, EntryType.TASK, "cat dog dog dog");
        index.add(BIRD, EntryType.FILE, "bird");

        List<SearchHit> all = index.search("cat", 10, null, null);
        assertEquals(2, all.size());

        List<SearchHit> strong = index.search("cat", 10, 0.9, null);
        assertEquals(1, strong.size());
        assertEquals(CAT, strong.get(0).getEntryId());

        List<SearchHit> tasks = index.search("cat", 10, null, Set.of(EntryType.TASK));
        assertEquals(1, tasks.size());
        assertEquals(DOG, tasks.get(0).getEntryId());
        assertEquals(EntryType.TASK, tasks.get(0).getEntryType());
    }

    // ==================== Mutation ====================

    @Test
    void shouldRecomputeWeightsAfterRemoval() {
        index.add(CAT, "the cat sat");
        index.add(DOG, "the dog sat");
        assertTrue(index.idf("cat") > 0.0);

        assertTrue(index.remove(DOG));

        assertFalse(index.remove(DOG));
        assertFalse(index.contains(DOG));
        assertEquals(1, index.size());
        assertEquals(0.0, index.idf("cat"), 1e-12);
        assertEquals(0.0, index.idf("dog"), 1e-12);
        assertEquals(3, index.vocabularySize());
    }

    @Test
    void shouldReplaceDocumentOnReAdd() {
        index.add(CAT, "the cat sat");
        index.add(DOG, "the dog sat");

        index.add(CAT, "a bird flew");

        assertEquals(2, index.size());
        assertTrue(index.search("cat").isEmpty());
        assertEquals(CAT, index.search("bird").get(0).getEntryId());
    }

    @Test
    void shouldClearEverything() {
        index.add(CAT, "the cat sat");
        index.add(DOG, "the dog sat");

        index.clear();

        assertEquals(0, index.size());
        assertEquals(0, index.vocabularySize());
        assertTrue(index.search("cat").isEmpty());
    }
}
