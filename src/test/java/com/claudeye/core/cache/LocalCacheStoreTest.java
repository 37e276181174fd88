package com.claudeye.core.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LocalCacheStoreTest {

    @TempDir
    Path tempDir;

    private LocalCacheStore store;

    record Sample(String name, int count) {}

    @BeforeEach
    void setUp() {
        store = new LocalCacheStore(tempDir.resolve("cache"));
    }

    private static CacheMeta meta(String contentHash) {
        return new CacheMeta("2026-01-01T00:00:00Z", contentHash, "", List.of("a"), null);
    }

    // ── get / set ──────────────────────────────────────────────────

    @Nested
    @DisplayName("get and set")
    class GetSet {

        @Test
        @DisplayName("stored value and meta are read back")
        void storedEntryIsReadBack() {
            store.set("evals/proj/sess", new Sample("x", 3), meta("h1"));

            Optional<CacheEntry<Sample>> entry = store.get("evals/proj/sess", Sample.class);

            assertTrue(entry.isPresent());
            assertEquals(new Sample("x", 3), entry.get().value());
            assertEquals("h1", entry.get().meta().contentHash());
            assertEquals(List.of("a"), entry.get().meta().registeredNames());
        }

        @Test
        @DisplayName("entry is written to {root}/{key}.json")
        void entryIsWrittenUnderRoot() {
            store.set("evals/proj/sess/items/check", new Sample("x", 1), meta("h"));

            assertTrue(Files.isRegularFile(tempDir.resolve("cache/evals/proj/sess/items/check.json")));
        }

        @Test
        @DisplayName("missing key is empty")
        void missingKeyIsEmpty() {
            assertTrue(store.get("evals/proj/none", Sample.class).isEmpty());
        }

        @Test
        @DisplayName("corrupt file reads as a miss")
        void corruptFileIsMiss() throws Exception {
            Path file = tempDir.resolve("cache/evals/proj/bad.json");
            Files.createDirectories(file.getParent());
            Files.writeString(file, "{not json");

            assertTrue(store.get("evals/proj/bad", Sample.class).isEmpty());
        }

        @Test
        @DisplayName("entry without meta reads as a miss")
        void entryWithoutMetaIsMiss() throws Exception {
            Path file = tempDir.resolve("cache/evals/proj/nometa.json");
            Files.createDirectories(file.getParent());
            Files.writeString(file, "{\"value\":{\"name\":\"x\",\"count\":1}}");

            assertTrue(store.get("evals/proj/nometa", Sample.class).isEmpty());
        }

        @Test
        @DisplayName("overwrite replaces the previous entry and leaves no temp files")
        void overwriteReplaces() throws Exception {
            store.set("evals/proj/sess", new Sample("old", 1), meta("h1"));
            store.set("evals/proj/sess", new Sample("new", 2), meta("h2"));

            assertEquals("new", store.get("evals/proj/sess", Sample.class).orElseThrow().value().name());
            try (var files = Files.list(tempDir.resolve("cache/evals/proj"))) {
                assertEquals(List.of("sess.json"),
                        files.map(p -> p.getFileName().toString()).toList());
            }
        }

        @Test
        @DisplayName("keys that escape the root are ignored")
        void escapingKeysIgnored() {
            store.set("../outside", new Sample("x", 1), meta("h"));

            assertFalse(Files.exists(tempDir.resolve("outside.json")));
            assertTrue(store.get("../outside", Sample.class).isEmpty());
            assertThrows(IllegalArgumentException.class, () -> store.fileFor("evals//sess"));
        }
    }

    // ── invalidation ───────────────────────────────────────────────

    @Nested
    @DisplayName("invalidation")
    class Invalidation {

        @Test
        @DisplayName("invalidate removes a single key")
        void invalidateSingleKey() {
            store.set("evals/proj/a", new Sample("a", 1), meta("h"));
            store.set("evals/proj/b", new Sample("b", 1), meta("h"));

            store.invalidate("evals/proj/a");

            assertTrue(store.get("evals/proj/a", Sample.class).isEmpty());
            assertTrue(store.get("evals/proj/b", Sample.class).isPresent());
        }

        @Test
        @DisplayName("prefix removes matching entries and their item directories only")
        void invalidateByPrefix() {
            store.set("evals/proj/sess", new Sample("whole", 1), meta("h"));
            store.set("evals/proj/sess/items/check", new Sample("item", 1), meta("h"));
            store.set("evals/other/sess", new Sample("other", 1), meta("h"));
            store.set("enrichments/proj/sess", new Sample("enrich", 1), meta("h"));

            store.invalidateByPrefix("evals/proj/");

            assertTrue(store.get("evals/proj/sess", Sample.class).isEmpty());
            assertTrue(store.get("evals/proj/sess/items/check", Sample.class).isEmpty());
            assertTrue(store.get("evals/other/sess", Sample.class).isPresent());
            assertTrue(store.get("enrichments/proj/sess", Sample.class).isPresent());
        }

        @Test
        @DisplayName("prefix may end in a partial file name")
        void invalidateByPartialName() {
            store.set("evals/proj/sess-1", new Sample("1", 1), meta("h"));
            store.set("evals/proj/sess-2", new Sample("2", 1), meta("h"));
            store.set("evals/proj/keep", new Sample("k", 1), meta("h"));

            store.invalidateByPrefix("evals/proj/sess");

            assertTrue(store.get("evals/proj/sess-1", Sample.class).isEmpty());
            assertTrue(store.get("evals/proj/sess-2", Sample.class).isEmpty());
            assertTrue(store.get("evals/proj/keep", Sample.class).isPresent());
        }

        @Test
        @DisplayName("prefix on a missing directory is a no-op")
        void invalidateMissingPrefix() {
            assertDoesNotThrow(() -> store.invalidateByPrefix("evals/nothing/"));
        }

        @Test
        @DisplayName("clearAll removes the whole root")
        void clearAll() {
            store.set("evals/proj/a", new Sample("a", 1), meta("h"));
            store.set("actions/proj/b", new Sample("b", 1), meta("h"));

            store.clearAll();

            assertFalse(Files.exists(store.root()));
            assertTrue(store.get("evals/proj/a", Sample.class).isEmpty());
        }
    }
}
