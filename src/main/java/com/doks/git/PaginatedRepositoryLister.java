package com.doks.git;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.doks.stream.ChannelStream;

public abstract class PaginatedRepositoryLister implements RepositoryLister {
    private static final Logger log = LoggerFactory.getLogger(PaginatedRepositoryLister.class);

    @Override
    public ChannelStream<RepositoryDescriptor> list() {
        return ChannelStream.open(sender -> {
            PageCursor cursor = null;
            int pages = 0;
            do {
                RepositoryPage page = fetchPage(cursor == null ? null : cursor.endCursor());
                pages++;
                log.debug("{} fetched page {} with {} repositories", describe(), pages, page.repositories().size());
                for (RepositoryDescriptor repository : page.repositories()) {
                    sender.send(repository);
                }
                cursor = page.cursor();
                if (cursor != null && cursor.hasNextPage() && (cursor.endCursor() == null || cursor.endCursor().isBlank())) {
                    throw new IOException(describe() + " page " + pages + " reported hasNextPage without endCursor");
                }
            } while (cursor != null && cursor.hasNextPage());
            log.info("{} listed {} pages", describe(), pages);
        });
    }

    /**
     * Fetches the page following {@code afterCursor}, or the first page when it is null.
     */
    protected abstract RepositoryPage fetchPage(String afterCursor) throws IOException;

    protected abstract String describe();
}
