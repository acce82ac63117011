package com.doks.git;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

public abstract class GithubGraphQlLister extends PaginatedRepositoryLister {
    public static final int DEFAULT_PAGE_SIZE = 50;

    private final GithubGraphQlClient client;
    private final int pageSize;
    private final GitCloneTransport transport;

    protected GithubGraphQlLister(GithubGraphQlClient client, int pageSize, GitCloneTransport transport) {
        if (pageSize < 1 || pageSize > 100) {
            throw new IllegalArgumentException("pageSize must be between 1 and 100, got " + pageSize);
        }
        this.client = client;
        this.pageSize = pageSize;
        this.transport = transport;
    }

    protected abstract String query();

    protected abstract Map<String, Object> variables();

    protected abstract String[] connectionPath();

    @Override
    protected RepositoryPage fetchPage(String afterCursor) throws IOException {
        Map<String, Object> variables = new HashMap<>(variables());
        variables.put("first", pageSize);
        variables.put("after", afterCursor);
        JsonNode data = client.execute(query(), variables);
        JsonNode connection = JsonPaths.require(data, connectionPath());

        List<RepositoryDescriptor> repositories = new ArrayList<>();
        for (JsonNode node : JsonPaths.requireArray(connection, "nodes")) {
            if (node == null || node.isNull() || node.isEmpty()) {
                continue;
            }
            repositories.add(toDescriptor(node));
        }
        JsonNode pageInfo = JsonPaths.require(connection, "pageInfo");
        JsonNode endCursor = pageInfo.get("endCursor");
        PageCursor cursor = new PageCursor(
                endCursor == null || endCursor.isNull() ? null : endCursor.asText(),
                pageInfo.path("hasNextPage").asBoolean(false));
        return new RepositoryPage(repositories, cursor);
    }

    private RepositoryDescriptor toDescriptor(JsonNode node) throws IOException {
        String name = node.hasNonNull("nameWithOwner")
                ? node.get("nameWithOwner").asText()
                : JsonPaths.requireText(node, "name");
        String cloneUrl = transport == GitCloneTransport.SSH
                ? JsonPaths.requireText(node, "sshUrl")
                : JsonPaths.requireText(node, "url");
        return new RepositoryDescriptor(name, cloneUrl);
    }

    @Override
    protected String describe() {
        return getClass().getSimpleName() + "{endpoint=" + client.endpoint() + "}";
    }
}
