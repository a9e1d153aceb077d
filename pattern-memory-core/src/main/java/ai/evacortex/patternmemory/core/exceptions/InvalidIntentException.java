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
 * Thrown synchronously, before any tier I/O, when a query intent is malformed.
 */
public class InvalidIntentException extends RuntimeException {
    public InvalidIntentException(String message) {
        super(message);
    }
}
