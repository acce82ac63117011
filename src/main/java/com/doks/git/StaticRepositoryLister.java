package com.doks.git;

import java.util.List;

import com.doks.stream.ChannelStream;

public class StaticRepositoryLister implements RepositoryLister {
    private final List<RepositoryDescriptor> repositories;

    public StaticRepositoryLister(List<RepositoryDescriptor> repositories) {
        this.repositories = List.copyOf(repositories);
    }

    @Override
    public ChannelStream<RepositoryDescriptor> list() {
        return ChannelStream.of(repositories);
    }

    public List<RepositoryDescriptor> repositories() {
        return repositories;
    }
}
