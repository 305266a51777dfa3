package me.golemcore.context.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextEntryTest {

    private static final Instant CREATED_AT = Instant.parse("2026-03-01T12:00:00Z");

    private ContextEntry.ContextEntryBuilder entry() {
        return ContextEntry.builder()
                .id("ctx_abcd1234")
                .entryType(EntryType.FILE)
                .source("src/Main.java")
                .content("public class Main {}")
                .summary("Main class")
                .createdAt(CREATED_AT);
    }

    @Test
    void shouldApplyBuilderDefaults() {
        ContextEntry built = entry().build();

        assertTrue(built.isSearchable());
        assertFalse(built.isCompressed());
        assertTrue(built.getReferences().isEmpty());
        assertTrue(built.getDerivedFrom().isEmpty());
        assertNull(built.getParentId());
        assertFalse(built.hasTtl());
    }

    @Test
    void shouldApplyDefaultsWithNoArgsConstructor() {
        ContextEntry empty = new ContextEntry();

        assertTrue(empty.isSearchable());
        assertTrue(empty.getReferences().isEmpty());
        assertTrue(empty.getDerivedFrom().isEmpty());
    }

    @Test
    void shouldNeverExpireWithoutTtl() {
        ContextEntry built = entry().build();

        assertNull(built.expiresAt());
        assertFalse(built.isExpired(CREATED_AT.plusSeconds(365L * 24 * 3600)));
    }

    @Test
    void shouldExpireOnlyAfterTtlElapsed() {
        ContextEntry built = entry().ttl(100L).build();

        assertEquals(CREATED_AT.plusMillis(100), built.expiresAt());
        assertFalse(built.isExpired(CREATED_AT.plusMillis(99)));
        assertFalse(built.isExpired(CREATED_AT.plusMillis(100)));
        assertTrue(built.isExpired(CREATED_AT.plusMillis(101)));
    }

    @Test
    void shouldIndexContentWhileAvailable() {
        assertEquals("public class Main {}", entry().build().indexableText());
    }

    @Test
    void shouldIndexSummaryWhenCompressedOrContentMissing() {
        assertEquals("Main class", entry().content(null).compressed(true).build().indexableText());
        assertEquals("Main class", entry().content("   ").build().indexableText());
        assertEquals("", entry().content(null).summary(null).build().indexableText());
    }

    @Test
    void shouldCopyListsDeeply() {
        ContextEntry original = entry()
                .references(new ArrayList<>(List.of("ctx_ref00001")))
                .derivedFrom(new ArrayList<>(List.of("ctx_src00001")))
                .build();

        ContextEntry copy = original.copy();
        copy.getReferences().add("ctx_ref00002");
        copy.getDerivedFrom().clear();

        assertEquals(original.getId(), copy.getId());
        assertNotSame(original.getReferences(), copy.getReferences());
        assertEquals(List.of("ctx_ref00001"), original.getReferences());
        assertEquals(List.of("ctx_src00001"), original.getDerivedFrom());
    }

    @Test
    void shouldCopyWhenListsAreNull() {
        ContextEntry original = entry().build();
        original.setReferences(null);
        original.setDerivedFrom(null);

        ContextEntry copy = original.copy();

        assertTrue(copy.getReferences().isEmpty());
        assertTrue(copy.getDerivedFrom().isEmpty());
    }
}
