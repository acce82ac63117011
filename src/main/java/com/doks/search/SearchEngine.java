package com.doks.search;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

import com.doks.sources.Document;
import com.doks.stream.ChannelStream;

public interface SearchEngine extends Closeable {
    void index(List<Document> documents) throws IOException;

    ChannelStream<FoundItem> search(String query);

    void purge() throws IOException;
}
