package com.doks.git;

import com.doks.stream.ChannelStream;

public interface RepositoryLister {
    ChannelStream<RepositoryDescriptor> list();
}
