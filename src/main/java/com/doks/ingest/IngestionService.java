package com.doks.ingest;

import java.io.IOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.doks.search.SearchEngine;
import com.doks.sources.Document;
import com.doks.sources.DocumentSource;
import com.doks.stream.Batcher;
import com.doks.stream.ChannelStream;
import com.doks.stream.StreamException;

public class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    public static final int DEFAULT_BATCH_SIZE = 10;

    private final SearchEngine searchEngine;
    private final int batchSize;

    public IngestionService(SearchEngine searchEngine) {
        this(searchEngine, DEFAULT_BATCH_SIZE);
    }

    public IngestionService(SearchEngine searchEngine, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
        this.searchEngine = searchEngine;
        this.batchSize = batchSize;
    }

    public IngestionReport ingest(List<DocumentSource> sources) throws IOException {
        int batches = 0;
        int documents = 0;
        for (DocumentSource source : sources) {
            log.info("Indexing source '{}'", source.id());
            int sourceDocuments = 0;
            try (ChannelStream<List<Document>> stream = Batcher.batched(source.fetch(), batchSize)) {
                while (hasNext(stream, source)) {
                    List<Document> batch = next(stream, source);
                    try {
                        searchEngine.index(batch);
                    } catch (IOException e) {
                        throw new IOException("Error occurred while indexing documents from source '" + source.id() + "': "
                                + e.getMessage(), e);
                    }
                    batches++;
                    sourceDocuments += batch.size();
                    log.debug("Indexed batch of {} documents from source '{}'", batch.size(), source.id());
                }
            }
            documents += sourceDocuments;
            log.info("Indexed source '{}' documents={}", source.id(), sourceDocuments);
        }
        return new IngestionReport(sources.size(), batches, documents);
    }

    private static boolean hasNext(ChannelStream<List<Document>> stream, DocumentSource source) throws IOException {
        try {
            return stream.hasNext();
        } catch (StreamException e) {
            throw fetchFailure(e, source);
        }
    }

    private static List<Document> next(ChannelStream<List<Document>> stream, DocumentSource source) throws IOException {
        try {
            return stream.next();
        } catch (StreamException e) {
            throw fetchFailure(e, source);
        }
    }

    private static IOException fetchFailure(StreamException e, DocumentSource source) {
        return e.asIOException("Error occurred while fetching documents from source '" + source.id() + "'");
    }
}
