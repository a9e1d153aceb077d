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
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Backing store of one storage tier. Implementations may block on I/O and may throw any
 * runtime exception; callers reach them only through {@link TierAdapter}.
 */
public interface TierStore {

    void put(String id, PatternRecord record);

    Optional<PatternRecord> get(String id);

    /**
     * @return {@code true} if a record was removed
     */
    boolean delete(String id);

    List<PatternRecord> scan(Predicate<PatternRecord> filter);

    default List<PatternRecord> scanAll() {
        return scan(r -> true);
    }

    int size();
}
