/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.field;

public enum FieldShape {
    SPHERICAL,
    /** Stretched along the X axis. */
    ELLIPTICAL,
    /** Modulated by deterministic band-limited noise. */
    FRACTAL,
    /** Scaled by the context sensitivity of the field. */
    ADAPTIVE
}
