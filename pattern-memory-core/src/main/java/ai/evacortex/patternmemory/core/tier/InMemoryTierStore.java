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

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

public class InMemoryTierStore implements TierStore {

    private final Map<String, PatternRecord> records = new ConcurrentHashMap<>();

    @Override
    public void put(String id, PatternRecord record) {
        records.put(id, record);
    }

    @Override
    public Optional<PatternRecord> get(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public boolean delete(String id) {
        return records.remove(id) != null;
    }

    @Override
    public List<PatternRecord> scan(Predicate<PatternRecord> filter) {
        return records.values().stream().filter(filter).toList();
    }

    @Override
    public int size() {
        return records.size();
    }
}
