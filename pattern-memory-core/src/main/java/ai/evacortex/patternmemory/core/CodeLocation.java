/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CodeLocation(String file,
                           int startLine,
                           int endLine,
                           int startColumn,
                           int endColumn,
                           String symbolName) {

    public CodeLocation {
        if (file == null || file.isBlank()) throw new IllegalArgumentException("file must not be blank");
        if (endLine < startLine) throw new IllegalArgumentException("endLine < startLine: " + endLine + " < " + startLine);
    }

    public static CodeLocation of(String file, int startLine, int endLine) {
        return new CodeLocation(file, startLine, endLine, 0, 0, null);
    }

    /** {@code file:start-end}, the key used for overlap and union. */
    public String spanKey() {
        return file + ":" + startLine + "-" + endLine;
    }
}
