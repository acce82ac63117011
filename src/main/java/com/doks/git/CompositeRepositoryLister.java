package com.doks.git;

import java.util.List;

import com.doks.stream.ChannelStream;

public class CompositeRepositoryLister implements RepositoryLister {
    private final List<RepositoryLister> listers;

    public CompositeRepositoryLister(List<RepositoryLister> listers) {
        this.listers = List.copyOf(listers);
    }

    @Override
    public ChannelStream<RepositoryDescriptor> list() {
        return ChannelStream.open(sender -> {
            for (RepositoryLister lister : listers) {
                try (ChannelStream<RepositoryDescriptor> repositories = lister.list()) {
                    while (repositories.hasNext()) {
                        sender.send(repositories.next());
                    }
                }
            }
        });
    }
}
