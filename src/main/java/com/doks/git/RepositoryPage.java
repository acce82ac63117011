package com.doks.git;

import java.util.List;

public record RepositoryPage(List<RepositoryDescriptor> repositories, PageCursor cursor) {
}
