package com.claudeye.core.cache;

import com.claudeye.core.evals.EvalsProperties;
import com.claudeye.core.metrics.ClaudeyeMetrics;
import com.claudeye.core.transcript.TranscriptProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CacheManagerTest {

    @TempDir
    Path tempDir;

    private TranscriptProperties transcriptProperties;
    private EvalsProperties evalsProperties;
    private CacheProperties cacheProperties;
    private ContentHasher hasher;
    private LocalCacheStore store;
    private SimpleMeterRegistry meterRegistry;
    private CacheManager cache;
    private Path sessionFile;

    record Verdict(boolean pass, String note) {}

    @BeforeEach
    void setUp() throws Exception {
        transcriptProperties = new TranscriptProperties();
        transcriptProperties.setPath(tempDir.resolve("projects").toString());
        evalsProperties = new EvalsProperties();
        cacheProperties = new CacheProperties();
        hasher = new ContentHasher(transcriptProperties, evalsProperties);
        store = new LocalCacheStore(tempDir.resolve("cache"));
        meterRegistry = new SimpleMeterRegistry();
        cache = new CacheManager(cacheProperties, store, hasher, new ClaudeyeMetrics(meterRegistry));

        sessionFile = tempDir.resolve("projects/proj/sess.jsonl");
        Files.createDirectories(sessionFile.getParent());
        Files.writeString(sessionFile, "{\"type\":\"user\"}\n");
    }

    private void appendToSession() throws Exception {
        Files.writeString(sessionFile, Files.readString(sessionFile) + "{\"type\":\"assistant\"}\n");
    }

    // ── whole-result ───────────────────────────────────────────────

    @Nested
    @DisplayName("whole-result entries")
    class WholeResult {

        @Test
        @DisplayName("hit when transcript, module and names are unchanged, in any name order")
        void hitWithReorderedNames() {
            cache.setWholeResult(CacheKind.EVALS, "proj", "sess", new Verdict(true, "ok"), List.of("a", "b"));

            Optional<CacheEntry<Verdict>> hit =
                    cache.getWholeResult(CacheKind.EVALS, "proj", "sess", List.of("b", "a"), Verdict.class);

            assertTrue(hit.isPresent());
            assertEquals(new Verdict(true, "ok"), hit.get().value());
            assertEquals(hasher.hashSessionFile("proj", "sess"), hit.get().meta().contentHash());
            assertNotNull(hit.get().meta().cachedAt());
        }

        @Test
        @DisplayName("miss after the transcript grows")
        void missAfterTranscriptChange() throws Exception {
            cache.setWholeResult(CacheKind.EVALS, "proj", "sess", new Verdict(true, "ok"), List.of("a"));

            appendToSession();

            assertTrue(cache.getWholeResult(CacheKind.EVALS, "proj", "sess", List.of("a"), Verdict.class).isEmpty());
        }

        @Test
        @DisplayName("miss after the evaluation module changes")
        void missAfterModuleChange() throws Exception {
            Path module = tempDir.resolve("evals.jar");
            Files.writeString(module, "v1");
            evalsProperties.setModule(module.toString());
            cache.setWholeResult(CacheKind.EVALS, "proj", "sess", new Verdict(true, "ok"), List.of("a"));

            Files.writeString(module, "v2");

            assertTrue(cache.getWholeResult(CacheKind.EVALS, "proj", "sess", List.of("a"), Verdict.class).isEmpty());
        }

        @Test
        @DisplayName("miss when a name is added or removed")
        void missWhenNameSetChanges() {
            cache.setWholeResult(CacheKind.EVALS, "proj", "sess", new Verdict(true, "ok"), List.of("a", "b"));

            assertTrue(cache.getWholeResult(CacheKind.EVALS, "proj", "sess",
                    List.of("a", "b", "c"), Verdict.class).isEmpty());
            assertTrue(cache.getWholeResult(CacheKind.EVALS, "proj", "sess",
                    List.of("a"), Verdict.class).isEmpty());
        }

        @Test
        @DisplayName("kinds are isolated from each other")
        void kindsAreIsolated() {
            cache.setWholeResult(CacheKind.EVALS, "proj", "sess", new Verdict(true, "ok"), List.of("a"));

            assertTrue(cache.getWholeResult(CacheKind.ENRICHMENTS, "proj", "sess",
                    List.of("a"), Verdict.class).isEmpty());
        }

        @Test
        @DisplayName("override hash replaces the transcript hash")
        void overrideHash() {
            cache.setWholeResult(CacheKind.FILTERS, "proj", "default/sess",
                    new Verdict(true, "f"), List.of("f"), "abc");

            assertTrue(cache.getWholeResult(CacheKind.FILTERS, "proj", "default/sess",
                    List.of("f"), Verdict.class, "abc").isPresent());
            assertTrue(cache.getWholeResult(CacheKind.FILTERS, "proj", "default/sess",
                    List.of("f"), Verdict.class, "def").isEmpty());
        }

        @Test
        @DisplayName("nothing is written when the transcript is missing")
        void noWriteWithoutTranscript() {
            cache.setWholeResult(CacheKind.EVALS, "proj", "ghost", new Verdict(true, "ok"), List.of("a"));

            assertFalse(Files.exists(store.fileFor("evals/proj/ghost")));
            assertTrue(cache.getWholeResult(CacheKind.EVALS, "proj", "ghost", List.of("a"), Verdict.class).isEmpty());
        }

        @Test
        @DisplayName("invalidateProject drops one kind for one project")
        void invalidateProject() {
            cache.setWholeResult(CacheKind.EVALS, "proj", "sess", new Verdict(true, "ok"), List.of("a"));
            cache.setWholeResult(CacheKind.ENRICHMENTS, "proj", "sess", new Verdict(true, "ok"), List.of("a"));

            cache.invalidateProject(CacheKind.EVALS, "proj");

            assertTrue(cache.getWholeResult(CacheKind.EVALS, "proj", "sess", List.of("a"), Verdict.class).isEmpty());
            assertTrue(cache.getWholeResult(CacheKind.ENRICHMENTS, "proj", "sess", List.of("a"), Verdict.class).isPresent());
        }
    }

    // ── per-item ───────────────────────────────────────────────────

    @Nested
    @DisplayName("per-item entries")
    class PerItem {

        private String contentHash;

        @BeforeEach
        void hash() {
            contentHash = hasher.hashSessionFile("proj", "sess");
        }

        @Test
        @DisplayName("items are cached independently")
        void itemsIndependent() {
            cache.setPerItem(CacheKind.EVALS, "proj", "sess", "a", "code-a", new Verdict(true, "a"), contentHash);

            assertTrue(cache.getPerItem(CacheKind.EVALS, "proj", "sess", "a", "code-a",
                    contentHash, Verdict.class).isPresent());
            assertTrue(cache.getPerItem(CacheKind.EVALS, "proj", "sess", "b", "code-b",
                    contentHash, Verdict.class).isEmpty());
        }

        @Test
        @DisplayName("changing one item's code invalidates only that item")
        void codeChangeInvalidatesOnlyThatItem() {
            cache.setPerItem(CacheKind.EVALS, "proj", "sess", "a", "code-a", new Verdict(true, "a"), contentHash);
            cache.setPerItem(CacheKind.EVALS, "proj", "sess", "b", "code-b", new Verdict(true, "b"), contentHash);

            assertTrue(cache.getPerItem(CacheKind.EVALS, "proj", "sess", "b", "code-b2",
                    contentHash, Verdict.class).isEmpty());
            assertTrue(cache.getPerItem(CacheKind.EVALS, "proj", "sess", "a", "code-a",
                    contentHash, Verdict.class).isPresent());
        }

        @Test
        @DisplayName("content hash mismatch or empty hash is a miss")
        void contentHashMismatch() {
            cache.setPerItem(CacheKind.EVALS, "proj", "sess", "a", "code-a", new Verdict(true, "a"), contentHash);

            assertTrue(cache.getPerItem(CacheKind.EVALS, "proj", "sess", "a", "code-a",
                    "other", Verdict.class).isEmpty());
            assertTrue(cache.getPerItem(CacheKind.EVALS, "proj", "sess", "a", "code-a",
                    "", Verdict.class).isEmpty());
        }

        @Test
        @DisplayName("empty content hash is never written")
        void emptyHashNotWritten() {
            cache.setPerItem(CacheKind.EVALS, "proj", "sess", "a", "code-a", new Verdict(true, "a"), "");

            assertFalse(Files.exists(store.fileFor("evals/proj/sess/items/a")));
        }

        @Test
        @DisplayName("item names are encoded into a single path segment")
        void itemNameEncoded() {
            cache.setPerItem(CacheKind.EVALS, "proj", "sess", "has/slash", "c", new Verdict(true, "x"), contentHash);

            assertTrue(Files.exists(store.fileFor("evals/proj/sess/items/has%2Fslash")));
            assertTrue(cache.getPerItem(CacheKind.EVALS, "proj", "sess", "has/slash", "c",
                    contentHash, Verdict.class).isPresent());
        }

        @Test
        @DisplayName("subagent keys nest under the parent session")
        void subagentKeys() {
            assertEquals("evals/proj/sess/agent-a1/items/check",
                    CacheManager.itemKey(CacheKind.EVALS, "proj", "sess/agent-a1", "check"));
        }
    }

    // ── switches and failures ──────────────────────────────────────

    @Test
    @DisplayName("disabled cache never reads or writes, and stays disabled")
    void disabledCacheIsFrozen() {
        cacheProperties.setMode("off");
        CacheManager disabled = new CacheManager(cacheProperties, store, hasher, null);

        disabled.setWholeResult(CacheKind.EVALS, "proj", "sess", new Verdict(true, "ok"), List.of("a"));
        cacheProperties.setMode("on");

        assertFalse(disabled.isEnabled());
        assertFalse(Files.exists(store.fileFor("evals/proj/sess")));
        cache.setWholeResult(CacheKind.EVALS, "proj", "sess", new Verdict(true, "ok"), List.of("a"));
        assertTrue(disabled.getWholeResult(CacheKind.EVALS, "proj", "sess", List.of("a"), Verdict.class).isEmpty());
    }

    @Test
    @DisplayName("store failures are reported as misses")
    void storeFailureIsMiss() {
        CacheStore failing = mock(CacheStore.class);
        when(failing.get(anyString(), any())).thenThrow(new IllegalStateException("disk gone"));
        CacheManager manager = new CacheManager(cacheProperties, failing, hasher, null);

        assertTrue(manager.getWholeResult(CacheKind.EVALS, "proj", "sess", List.of("a"), Verdict.class).isEmpty());
        assertTrue(manager.getPerItem(CacheKind.EVALS, "proj", "sess", "a", "c", "h", Verdict.class).isEmpty());
    }

    @Test
    @DisplayName("lookups are counted by kind, granularity and result")
    void lookupsAreCounted() {
        cache.setWholeResult(CacheKind.EVALS, "proj", "sess", new Verdict(true, "ok"), List.of("a"));
        cache.getWholeResult(CacheKind.EVALS, "proj", "sess", List.of("a"), Verdict.class);
        cache.getWholeResult(CacheKind.EVALS, "proj", "sess", List.of("b"), Verdict.class);

        assertEquals(1.0, meterRegistry.get("claudeye.cache.lookups")
                .tag("kind", "evals").tag("granularity", "whole").tag("result", "hit").counter().count());
        assertEquals(1.0, meterRegistry.get("claudeye.cache.lookups")
                .tag("kind", "evals").tag("granularity", "whole").tag("result", "miss").counter().count());
    }
}
