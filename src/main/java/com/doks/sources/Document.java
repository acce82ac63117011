package com.doks.sources;

import java.util.Map;

public record Document(
        String id,
        String source,
        String title,
        String link,
        String content,
        Map<String, String> metadata) {

    public Document {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("document id must not be blank");
        }
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("document source must not be blank");
        }
        title = title == null ? "" : title;
        link = link == null ? "" : link;
        content = content == null ? "" : content;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public Document(String id, String source, String title, String link, String content) {
        this(id, source, title, link, content, Map.of());
    }
}
