package com.doks.git;

import java.util.Map;

public class GithubSearchRepositoryLister extends GithubGraphQlLister {
    private static final String QUERY = """
            query($query: String!, $first: Int!, $after: String) {
              search(query: $query, type: REPOSITORY, first: $first, after: $after) {
                pageInfo { endCursor hasNextPage }
                nodes { ... on Repository { nameWithOwner sshUrl url } }
              }
            }
            """;

    private final String search;

    public GithubSearchRepositoryLister(GithubGraphQlClient client, String search, int pageSize, GitCloneTransport transport) {
        super(client, pageSize, transport);
        if (search == null || search.isBlank()) {
            throw new IllegalArgumentException("search must not be blank");
        }
        this.search = search;
    }

    @Override
    protected String query() {
        return QUERY;
    }

    @Override
    protected Map<String, Object> variables() {
        return Map.of("query", search);
    }

    @Override
    protected String[] connectionPath() {
        return new String[] { "search" };
    }

    @Override
    protected String describe() {
        return "GithubSearchRepositoryLister{search=" + search + "}";
    }
}
