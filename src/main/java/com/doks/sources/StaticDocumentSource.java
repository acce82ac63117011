package com.doks.sources;

import java.util.List;

import com.doks.stream.ChannelStream;

public class StaticDocumentSource implements DocumentSource {
    private final String sourceId;
    private final List<Document> documents;

    public StaticDocumentSource(String sourceId, List<Document> documents) {
        for (Document document : documents) {
            if (!document.source().equals(sourceId)) {
                throw new IllegalArgumentException("Document '" + document.id() + "' belongs to source '"
                        + document.source() + "', expected '" + sourceId + "'");
            }
        }
        this.sourceId = sourceId;
        this.documents = List.copyOf(documents);
    }

    @Override
    public String id() {
        return sourceId;
    }

    @Override
    public ChannelStream<Document> fetch() {
        return ChannelStream.of(documents);
    }
}
