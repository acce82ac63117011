package com.doks.git;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class GithubGraphQlClient {
    private static final Logger log = LoggerFactory.getLogger(GithubGraphQlClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    public static final String DEFAULT_ENDPOINT = "https://api.github.com/graphql";

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String token;

    public GithubGraphQlClient(OkHttpClient httpClient, String endpoint, String token) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint;
        this.token = token;
    }

    public JsonNode execute(String query, Map<String, Object> variables) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("variables", variables);
        Request.Builder requestBuilder = new Request.Builder()
                .url(endpoint)
                .header("Accept", "application/json")
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON));
        if (token != null && !token.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + token);
        }
        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new IOException("GraphQL request to " + endpoint + " failed with HTTP " + response.code() + ": " + text);
            }
            JsonNode root = mapper.readTree(text);
            JsonNode errors = root == null ? null : root.get("errors");
            if (errors != null && errors.isArray() && errors.size() > 0) {
                throw new IOException("GraphQL request to " + endpoint + " returned errors: " + errors);
            }
            log.trace("GraphQL response from {}: {}", endpoint, text);
            return JsonPaths.require(root, "data");
        }
    }

    public String endpoint() {
        return endpoint;
    }
}
