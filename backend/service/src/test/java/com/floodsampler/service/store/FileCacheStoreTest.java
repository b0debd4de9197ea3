package com.floodsampler.service.store;

import com.floodsampler.core.model.FetchKey;
import com.floodsampler.core.model.TimeInterval;
import com.floodsampler.sources.api.CacheConsistencyException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileCacheStoreTest {
    private static final FetchKey KEY = new FetchKey("iem-vtec-fl", "US-TX-travis", new TimeInterval(
            Instant.parse("2025-01-01T00:00:00Z"), Instant.parse("2025-04-01T00:00:00Z")));

    @TempDir
    Path tempDir;

    @Test
    void putThenGetReturnsExactPayload() {
        FileCacheStore store = new FileCacheStore(tempDir.resolve("cache"));
        String payload = "[{\"id\":\"EWX-2025-FL.W.12\",\"note\":\"ünïcode\"}]";

        assertEquals(Optional.empty(), store.get(KEY));
        store.put(KEY, payload);

        assertEquals(Optional.of(payload), store.get(KEY));
        assertEquals(Optional.of(payload), new FileCacheStore(tempDir.resolve("cache")).get(KEY));
    }

    @Test
    void entriesAreShardedBySourceAndFingerprint() {
        FileCacheStore store = new FileCacheStore(tempDir);
        store.put(KEY, "[]");

        Path expected = tempDir.resolve("iem-vtec-fl")
                .resolve(KEY.fingerprint().substring(0, 2))
                .resolve(KEY.fingerprint() + ".json");
        assertEquals(expected, store.fileFor(KEY));
        assertTrue(Files.exists(expected));
    }

    @Test
    void identicalPutIsANoOp() {
        FileCacheStore store = new FileCacheStore(tempDir);
        store.put(KEY, "[1,2,3]");
        store.put(KEY, "[1,2,3]");

        assertEquals(Optional.of("[1,2,3]"), store.get(KEY));
    }

    @Test
    void conflictingPutFailsAndKeepsOriginal() {
        FileCacheStore store = new FileCacheStore(tempDir);
        store.put(KEY, "[1,2,3]");

        CacheConsistencyException error = assertThrows(CacheConsistencyException.class, () -> store.put(KEY, "[1,2,4]"));

        assertEquals(KEY, error.key());
        assertEquals(Optional.of("[1,2,3]"), store.get(KEY));
    }

    @Test
    void concurrentWritersLeaveOneEntryAndNoTempFiles() throws Exception {
        FileCacheStore first = new FileCacheStore(tempDir);
        FileCacheStore second = new FileCacheStore(tempDir);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 16; i++) {
                FileCacheStore store = i % 2 == 0 ? first : second;
                futures.add(pool.submit(() -> {
                    start.await();
                    store.put(KEY, "[\"same\"]");
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(Optional.of("[\"same\"]"), first.get(KEY));
        try (Stream<Path> files = Files.walk(tempDir)) {
            List<Path> regular = files.filter(Files::isRegularFile).toList();
            assertEquals(1, regular.size(), "files: " + regular);
        }
    }
}
