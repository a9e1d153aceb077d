/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.field;

import ai.evacortex.patternmemory.core.exceptions.InvalidIntentException;

import java.util.Locale;

public enum QueryType {
    PRECISION,
    DISCOVERY,
    CREATIVE;

    public static QueryType of(String name) {
        if (name == null) throw new InvalidIntentException("queryType must not be null");
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidIntentException("Unknown queryType: " + name);
        }
    }
}
