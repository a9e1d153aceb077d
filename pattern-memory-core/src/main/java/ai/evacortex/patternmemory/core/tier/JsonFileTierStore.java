/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.tier;

import ai.evacortex.patternmemory.core.PatternRecord;
import ai.evacortex.patternmemory.core.StorageTier;
import ai.evacortex.patternmemory.core.exceptions.TierUnavailableException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Tier backend persisted as one pretty-printed JSON document. Every mutation rewrites the file
 * through a temporary sibling and an atomic move.
 */
public class JsonFileTierStore implements TierStore {

    private static final TypeReference<Map<String, PatternRecord>> TYPE = new TypeReference<>() {};

    private final StorageTier tier;
    private final Path file;
    private final Map<String, PatternRecord> store;
    private final ObjectMapper mapper;
    private final ReentrantReadWriteLock rwLock;

    public static JsonFileTierStore loadOrCreate(StorageTier tier, Path path) {
        JsonFileTierStore tierStore = new JsonFileTierStore(tier, path);
        if (Files.exists(path)) {
            try (InputStream in = Files.newInputStream(path)) {
                Map<String, PatternRecord> loaded = tierStore.mapper.readValue(in, TYPE);
                tierStore.store.putAll(loaded);
            } catch (IOException e) {
                throw new TierUnavailableException(tier, "failed to load " + path, e);
            }
        }
        return tierStore;
    }

    private JsonFileTierStore(StorageTier tier, Path file) {
        this.tier = tier;
        this.file = file;
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.store = new LinkedHashMap<>();
        this.rwLock = new ReentrantReadWriteLock();
    }

    public Path file() {
        return file;
    }

    @Override
    public void put(String id, PatternRecord record) {
        rwLock.writeLock().lock();
        try {
            PatternRecord previous = store.put(id, record);
            try {
                flush();
            } catch (TierUnavailableException e) {
                if (previous == null) store.remove(id); else store.put(id, previous);
                throw e;
            }
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public Optional<PatternRecord> get(String id) {
        rwLock.readLock().lock();
        try {
            return Optional.ofNullable(store.get(id));
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public boolean delete(String id) {
        rwLock.writeLock().lock();
        try {
            PatternRecord removed = store.remove(id);
            if (removed == null) return false;
            try {
                flush();
            } catch (TierUnavailableException e) {
                store.put(id, removed);
                throw e;
            }
            return true;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public List<PatternRecord> scan(Predicate<PatternRecord> filter) {
        rwLock.readLock().lock();
        try {
            return store.values().stream().filter(filter).toList();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        rwLock.readLock().lock();
        try {
            return store.size();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public void flush() {
        rwLock.writeLock().lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            try (OutputStream out = Files.newOutputStream(tmp, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, store);
            }
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new TierUnavailableException(tier, "failed to flush " + file, e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }
}
