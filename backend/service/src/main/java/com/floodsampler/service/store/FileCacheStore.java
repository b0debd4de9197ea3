package com.floodsampler.service.store;

import com.floodsampler.core.model.FetchKey;
import com.floodsampler.sources.api.CacheConsistencyException;
import com.floodsampler.sources.api.CacheStore;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

public class FileCacheStore implements CacheStore {
    private final Path root;
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public FileCacheStore(Path root) {
        this.root = root;
    }

    @Override
    public Optional<String> get(FetchKey key) {
        Path file = fileFor(key);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading cache entry " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(FetchKey key, String payload) {
        Path file = fileFor(key);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            if (Files.exists(file)) {
                requireSame(key, file, payload);
                return;
            }
            Files.createDirectories(file.getParent());
            Path tmp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            try {
                Files.writeString(tmp, payload, StandardCharsets.UTF_8);
                Files.move(tmp, file);
            } catch (FileAlreadyExistsException raced) {
                requireSame(key, file, payload);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing cache entry " + file, e);
        } finally {
            lock.unlock();
        }
    }

    Path fileFor(FetchKey key) {
        String fingerprint = key.fingerprint();
        return root.resolve(safeName(key.source()))
                .resolve(fingerprint.substring(0, 2))
                .resolve(fingerprint + ".json");
    }

    private ReentrantLock lockFor(FetchKey key) {
        return locks.computeIfAbsent(key.fingerprint(), ignored -> new ReentrantLock());
    }

    private static void requireSame(FetchKey key, Path file, String payload) throws IOException {
        String existing = Files.readString(file, StandardCharsets.UTF_8);
        if (!existing.equals(payload)) {
            throw new CacheConsistencyException(key, "stored " + existing.length() + " chars at " + file
                    + ", offered " + payload.length() + " chars");
        }
    }

    private static String safeName(String source) {
        return source.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
