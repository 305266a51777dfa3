package me.golemcore.context.domain.service;

import me.golemcore.context.domain.exception.EntryBoundsException;
import me.golemcore.context.domain.exception.EntryNotFoundException;
import me.golemcore.context.domain.model.AllocationStats;
import me.golemcore.context.domain.model.ContextAllocation;
import me.golemcore.context.domain.model.ContextEntryView;
import me.golemcore.context.domain.model.EntryType;
import me.golemcore.context.domain.model.ImplementationContext;
import me.golemcore.context.domain.model.ImplementationEntryView;
import me.golemcore.context.domain.model.WorkingContext;
import me.golemcore.context.infrastructure.config.ContextEngineProperties;
import me.golemcore.context.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static me.golemcore.context.testsupport.ContextFixtures.entry;
import static me.golemcore.context.testsupport.ContextFixtures.id;
import static me.golemcore.context.testsupport.ContextFixtures.store;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextBudgetAllocatorTest {

    private static final Instant BASE_TIME = Instant.parse("2026-03-01T12:00:00Z");

    private static final String A = "ctx_aaaaaaaa";
    private static final String B = "ctx_bbbbbbbb";
    private static final String C = "ctx_cccccccc";
    private static final String D = "ctx_dddddddd";
    private static final String MISSING = "ctx_zzzzzzzz";

    private MutableClock clock;
    private ContextStore store;
    private ContextEngineProperties properties;
    private ContextBudgetAllocator allocator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(BASE_TIME);
        store = store(clock);
        properties = new ContextEngineProperties();
        allocator = new ContextBudgetAllocator(store, properties, clock);
    }

    private void addChain(int length) {
        for (int i = 1; i <= length; i++) {
            store.add(entry(id(i)).parentId(i > 1 ? id(i - 1) : null).build());
        }
    }

    // ==================== Working context ====================

    @Test
    void shouldBuildSummaryOnlyWorkingContext() {
        store.add(entry(B).summary("12345678").createdAt(BASE_TIME.minusSeconds(10)).build());
        store.add(entry(A).summary("1234").createdAt(BASE_TIME.minusSeconds(10)).build());
        store.add(entry(C).summary("first").createdAt(BASE_TIME.minusSeconds(20)).build());

        WorkingContext context = allocator.buildWorkingContext();

        assertEquals(List.of(C, A, B), context.getEntries().stream().map(ContextEntryView::getId).toList());
        assertEquals(3, context.getTotalCount());
        assertEquals(1 + 1 + 2, context.getSummaryTokens());
        assertEquals("1234", context.getEntries().get(1).getSummary());
    }

    @Test
    void shouldLeaveOutExpiredAndNonSearchableEntries() {
        store.add(entry(A).build());
        store.add(entry(B).ttl(10L).build());
        store.add(entry(C).searchable(false).build());
        clock.advanceMillis(11);

        assertEquals(List.of(A), allocator.buildWorkingContext().getEntries().stream()
                .map(ContextEntryView::getId).toList());
        assertEquals(List.of(A, C), allocator.buildWorkingContext(null, true).getEntries().stream()
                .map(ContextEntryView::getId).toList());
    }

    @Test
    void shouldFilterWorkingContextByType() {
        store.add(entry(A).entryType(EntryType.FILE).build());
        store.add(entry(B).entryType(EntryType.TASK).build());

        WorkingContext context = allocator.buildWorkingContext(Set.of(EntryType.TASK), false);

        assertEquals(1, context.getTotalCount());
        assertEquals(B, context.getEntries().get(0).getId());
    }

    @Test
    void shouldNotCapWorkingContextSize() {
        for (int i = 1; i <= 250; i++) {
            store.add(entry(id(i)).build());
        }

        assertEquals(250, allocator.buildWorkingContext().getTotalCount());
    }

    // ==================== Implementation context ====================

    @Test
    void shouldResolveParentsAndSourcesTransitively() {
        store.add(entry(A).build());
        store.add(entry(B).parentId(A).build());
        store.add(entry(C).build());
        store.add(entry(D).parentId(B).derivedFrom(List.of(C)).build());

        assertEquals(List.of(D, B, C, A), allocator.resolveClosure(List.of(D)));
        assertEquals(List.of(C), allocator.resolveClosure(List.of(C, C)));
    }

    @Test
    void shouldMaterializeFullContentContext() {
        store.add(entry(A).content("12345678").build());
        store.add(entry(B).parentId(A).content("1234").build());

        ImplementationContext context = allocator.requestContext(List.of(B));

        assertTrue(context.getContextId().startsWith("impl_"));
        assertEquals(List.of(B), context.getRequestedIds());
        assertEquals(List.of(B, A), context.getEntryIds());
        assertEquals(2, context.getEntryCount());
        assertEquals(1 + 2, context.getTotalTokens());
        ImplementationEntryView view = context.getEntries().get(1);
        assertEquals("12345678", view.getContent());
        assertEquals(BASE_TIME, context.getAllocatedAt());
    }

    @Test
    void shouldAcceptClosureJustBelowLimit() {
        addChain(199);

        ImplementationContext context = allocator.requestContext(List.of(id(199)));

        assertEquals(199, context.getEntryCount());
    }

    @Test
    void shouldRejectClosureAtLimitBeforeMaterializing() {
        addChain(200);

        EntryBoundsException error = assertThrows(EntryBoundsException.class,
                () -> allocator.requestContext(List.of(id(200))));

        assertEquals(200, error.getRequested());
        assertEquals(200, error.getLimit());
        assertEquals(0, allocator.getUsageStats().getTotalRequests());
        assertTrue(allocator.getOutstandingAllocations().isEmpty());
    }

    @Test
    void shouldRejectFlatRequestOverLimit() {
        List<String> ids = new ArrayList<>();
        for (int i = 1; i <= 210; i++) {
            store.add(entry(id(i)).build());
            ids.add(id(i));
        }

        assertThrows(EntryBoundsException.class, () -> allocator.requestContext(ids));
        assertEquals(199, allocator.requestContext(ids.subList(0, 199)).getEntryCount());
    }

    @Test
    void shouldHonourConfiguredLimit() {
        properties.getBudget().setMaxImplementationEntries(3);
        addChain(3);

        assertThrows(EntryBoundsException.class, () -> allocator.requestContext(List.of(id(3))));
        assertEquals(2, allocator.requestContext(List.of(id(2))).getEntryCount());
        assertFalse(allocator.isWithinBounds(3));
        assertTrue(allocator.isWithinBounds(2));
    }

    @Test
    void shouldFailForMissingOrExpiredRequestedEntry() {
        store.add(entry(A).ttl(10L).build());

        EntryNotFoundException missing = assertThrows(EntryNotFoundException.class,
                () -> allocator.requestContext(List.of(MISSING)));
        assertEquals(MISSING, missing.getEntryId());

        clock.advanceMillis(11);
        assertThrows(EntryNotFoundException.class, () -> allocator.requestContext(List.of(A)));
    }

    @Test
    void shouldSkipExpiredDependencies() {
        store.add(entry(A).ttl(10L).build());
        store.add(entry(B).parentId(A).build());
        clock.advanceMillis(11);

        assertEquals(List.of(B), allocator.requestContext(List.of(B)).getEntryIds());
    }

    // ==================== Release and bookkeeping ====================

    @Test
    void shouldTrackAndReleaseAllocations() {
        store.add(entry(A).build());
        store.add(entry(B).parentId(A).build());

        ImplementationContext context = allocator.requestContext(List.of(B));

        assertTrue(allocator.isInUse(A));
        assertTrue(allocator.getAllocation(context.getContextId()).isPresent());
        assertTrue(allocator.releaseContext(context.getContextId()));
        assertFalse(allocator.releaseContext(context.getContextId()));
        assertFalse(allocator.releaseContext(null));
        assertFalse(allocator.isInUse(A));
        assertTrue(store.contains(A));

        AllocationStats stats = allocator.getUsageStats();
        assertEquals(0, stats.getOutstanding());
        assertEquals(1, stats.getTotalRequests());
        assertEquals(1, stats.getTotalReleases());
        assertEquals(2, stats.getEntriesServed());
    }

    @Test
    void shouldNotExposeStoredAllocations() {
        store.add(entry(A).build());
        ImplementationContext context = allocator.requestContext(List.of(A));

        allocator.getOutstandingAllocations().get(0).getEntryIds().clear();
        allocator.getAllocation(context.getContextId()).orElseThrow().getEntryIds().add(B);

        assertTrue(allocator.isInUse(A));
        assertFalse(allocator.isInUse(B));
        assertEquals(List.of(A), allocator.getAllocation(context.getContextId()).orElseThrow().getEntryIds());
        assertTrue(allocator.getAllocation(null).isEmpty());
    }

    @Test
    void shouldReleaseWhenHandlerFails() {
        store.add(entry(A).build());

        assertThrows(IllegalStateException.class, () -> allocator.withContext(List.of(A), context -> {
            throw new IllegalStateException("boom");
        }));

        assertTrue(allocator.getOutstandingAllocations().isEmpty());
        assertEquals(1, allocator.getUsageStats().getTotalReleases());
    }

    @Test
    void shouldReturnHandlerResultFromWithContext() {
        store.add(entry(A).build());

        Integer count = allocator.withContext(List.of(A), ImplementationContext::getEntryCount);

        assertEquals(1, count);
        assertTrue(allocator.getOutstandingAllocations().isEmpty());
    }

    @Test
    void shouldReportLeakedAllocations() {
        store.add(entry(A).build());
        store.add(entry(B).build());
        ImplementationContext old = allocator.requestContext(List.of(A));
        clock.advance(Duration.ofMinutes(11));
        allocator.requestContext(List.of(B));

        List<ContextAllocation> leaked = allocator.findLeakedAllocations();

        assertEquals(1, leaked.size());
        assertEquals(old.getContextId(), leaked.get(0).getContextId());
        assertEquals(BASE_TIME, leaked.get(0).getAllocatedAt());
        assertEquals(2, allocator.findLeakedAllocations(Duration.ofMillis(-1)).size());
    }

    @Test
    void shouldSplitIdsIntoChunksBelowLimit() {
        List<String> ids = new ArrayList<>();
        for (int i = 1; i <= 450; i++) {
            ids.add(id(i));
        }

        List<List<String>> batches = allocator.splitIntoBatches(ids);

        assertEquals(List.of(199, 199, 52), batches.stream().map(List::size).toList());
        assertEquals(id(200), batches.get(1).get(0));
        assertTrue(allocator.splitIntoBatches(List.of()).isEmpty());
    }
}
