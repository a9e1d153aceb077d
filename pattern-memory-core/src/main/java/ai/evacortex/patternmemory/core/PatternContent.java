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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Payload of a pattern. {@code data} is opaque to the engine.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PatternContent(String title,
                             String description,
                             String type,
                             List<String> tags,
                             byte[] data) {

    public PatternContent {
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        type = type == null ? "" : type;
        tags = tags == null ? List.of() : List.copyOf(tags);
        data = data == null ? new byte[0] : data.clone();
    }

    public static PatternContent of(String title, String description, String type) {
        return new PatternContent(title, description, type, List.of(), null);
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PatternContent that)) return false;
        return title.equals(that.title)
                && description.equals(that.description)
                && type.equals(that.type)
                && tags.equals(that.tags)
                && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(title, description, type, tags);
        return 31 * h + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "PatternContent[title=" + title + ", type=" + type + ", tags=" + tags + ", data=" + data.length + "B]";
    }
}
