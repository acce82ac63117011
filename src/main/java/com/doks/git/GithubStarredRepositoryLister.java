package com.doks.git;

import java.util.Map;

public class GithubStarredRepositoryLister extends GithubGraphQlLister {
    private static final String QUERY = """
            query($login: String!, $first: Int!, $after: String) {
              user(login: $login) {
                starredRepositories(first: $first, after: $after, orderBy: {field: STARRED_AT, direction: DESC}) {
                  pageInfo { endCursor hasNextPage }
                  nodes { nameWithOwner sshUrl url }
                }
              }
            }
            """;

    private final String login;

    public GithubStarredRepositoryLister(GithubGraphQlClient client, String login, int pageSize, GitCloneTransport transport) {
        super(client, pageSize, transport);
        if (login == null || login.isBlank()) {
            throw new IllegalArgumentException("login must not be blank");
        }
        this.login = login;
    }

    @Override
    protected String query() {
        return QUERY;
    }

    @Override
    protected Map<String, Object> variables() {
        return Map.of("login", login);
    }

    @Override
    protected String[] connectionPath() {
        return new String[] { "user", "starredRepositories" };
    }

    @Override
    protected String describe() {
        return "GithubStarredRepositoryLister{login=" + login + "}";
    }
}
