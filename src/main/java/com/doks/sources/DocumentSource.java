package com.doks.sources;

import com.doks.stream.ChannelStream;

public interface DocumentSource {
    String id();

    ChannelStream<Document> fetch();
}
