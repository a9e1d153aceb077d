/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Append-only window over the most recent {@code capacity} entries.
 * Entries are never mutated; the oldest one is dropped once the window is full.
 */
public final class BoundedAuditLog<T> {

    private final int capacity;
    private final Deque<T> entries;
    private long totalAppended;

    public BoundedAuditLog(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public synchronized void append(T entry) {
        if (entries.size() == capacity) {
            entries.pollFirst();
        }
        entries.addLast(entry);
        totalAppended++;
    }

    public synchronized List<T> snapshot() {
        return List.copyOf(new ArrayList<>(entries));
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long totalAppended() {
        return totalAppended;
    }

    public int capacity() {
        return capacity;
    }
}
