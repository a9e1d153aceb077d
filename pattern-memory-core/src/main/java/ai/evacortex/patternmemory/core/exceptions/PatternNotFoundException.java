/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.exceptions;

/**
 * No placement exists for the id, or its record vanished from the tier that should hold it.
 * Lookups through the facade report this as an empty result.
 */
public class PatternNotFoundException extends RuntimeException {

    private final String patternId;

    public PatternNotFoundException(String patternId) {
        super("No pattern placed under id '" + patternId + "'");
        this.patternId = patternId;
    }

    public String patternId() {
        return patternId;
    }
}
