/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.exceptions;

import ai.evacortex.patternmemory.core.engine.ConsistencyReport;

public class IndexInconsistencyException extends RuntimeException {

    private final transient ConsistencyReport report;

    public IndexInconsistencyException(String message) {
        this(message, null);
    }

    public IndexInconsistencyException(String message, ConsistencyReport report) {
        super(report == null ? message : message + ": " + report);
        this.report = report;
    }

    /**
     * @return the report that detected the mismatch, or {@code null} if raised by the index itself
     */
    public ConsistencyReport report() {
        return report;
    }
}
