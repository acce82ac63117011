package com.doks.runtime;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.doks.git.GitCloneTransport;
import com.doks.search.RefreshPolicy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldParseJsonRepositoryListConfig() throws Exception {
        AppConfig config = AppConfig.parse("""
                {
                  "sources": [{
                      "id": "github",
                      "source": "github",
                      "repositories": {
                        "from": "list",
                        "list": [
                          { "name": "wlezzar/jtab" },
                          { "name": "wlezzar/doks" },
                          { "name": "adevinta/zoe" }
                        ]
                      }
                  }],
                  "engine": {"use": "tantivy", "path": "/tmp/doks_index" }
                }
                """);

        assertEquals(1, config.getSources().size());
        AppConfig.GithubSourceConfig github = assertInstanceOf(AppConfig.GithubSourceConfig.class, config.getSources().get(0));
        assertEquals("github", github.getId());
        assertTrue(github.getInclude().isEmpty());
        assertTrue(github.getExclude().isEmpty());
        AppConfig.ListRepositoriesConfig list = assertInstanceOf(AppConfig.ListRepositoriesConfig.class, github.getRepositories());
        assertEquals("github.com", list.getServer());
        assertEquals(GitCloneTransport.SSH, list.getTransport());
        assertEquals(List.of("wlezzar/jtab", "wlezzar/doks", "adevinta/zoe"),
                list.getList().stream().map(AppConfig.RepositoryEntry::getName).toList());
        assertNull(list.getList().get(0).getBranch());
        assertEquals("/tmp/doks_index", config.getEngine().getPath());
    }

    @Test
    void shouldParseYamlWithEverySection() throws Exception {
        AppConfig config = AppConfig.parse("""
                sources:
                  - source: fs
                    id: notes
                    paths: [/home/me/notes]
                    include: "\\\\.md$"
                  - source: github
                    id: starred
                    repositories:
                      from: api
                      starred_by: [alice, bob]
                      search: "topic:docs"
                      token_file: /etc/token
                      transport: ssh
                      pageSize: 25
                engine:
                  path: /var/doks
                  refreshPolicy: periodic
                  refreshIntervalMs: 250
                ingestion:
                  batchSize: 50
                git:
                  cloneTimeoutSeconds: 60
                  workspacePath: /var/tmp/clones
                """);

        AppConfig.FileSystemSourceConfig notes = assertInstanceOf(AppConfig.FileSystemSourceConfig.class, config.getSources().get(0));
        assertEquals(List.of("/home/me/notes"), notes.getPaths());
        assertEquals(List.of("\\.md$"), notes.getInclude());

        AppConfig.GithubSourceConfig starred = assertInstanceOf(AppConfig.GithubSourceConfig.class, config.getSources().get(1));
        AppConfig.ApiRepositoriesConfig api = assertInstanceOf(AppConfig.ApiRepositoriesConfig.class, starred.getRepositories());
        assertEquals(List.of("alice", "bob"), api.getStarredBy());
        assertEquals("topic:docs", api.getSearch());
        assertEquals("/etc/token", api.getTokenFile());
        assertEquals(GitCloneTransport.SSH, api.getTransport());
        assertEquals(25, api.getPageSize());

        assertEquals("/var/doks", config.getEngine().getPath());
        assertEquals(RefreshPolicy.PERIODIC, config.getEngine().getRefreshPolicy());
        assertEquals(250, config.getEngine().getRefreshIntervalMs());
        assertEquals(50, config.getIngestion().getBatchSize());
        assertEquals(60, config.getGit().getCloneTimeoutSeconds());
        assertEquals("/var/tmp/clones", config.getGit().getWorkspacePath());
    }

    @Test
    void shouldApplyDefaultsForMissingSections() throws Exception {
        AppConfig config = AppConfig.parse("sources: []\n");

        assertTrue(config.getSources().isEmpty());
        assertEquals("/tmp/doks_index", config.getEngine().getPath());
        assertEquals(RefreshPolicy.ON_COMMIT, config.getEngine().getRefreshPolicy());
        assertEquals(10, config.getIngestion().getBatchSize());
        assertEquals(300, config.getGit().getCloneTimeoutSeconds());
        assertNull(config.getGit().getWorkspacePath());
    }

    @Test
    void shouldDefaultApiTransportToHttps() throws Exception {
        AppConfig config = AppConfig.parse("""
                sources:
                  - source: Github
                    id: gh
                    repositories:
                      from: FromApi
                      search: "user:wlezzar"
                """);

        AppConfig.GithubSourceConfig github = (AppConfig.GithubSourceConfig) config.getSources().get(0);
        AppConfig.ApiRepositoriesConfig api = (AppConfig.ApiRepositoriesConfig) github.getRepositories();
        assertEquals(GitCloneTransport.HTTPS, api.getTransport());
        assertEquals(50, api.getPageSize());
    }

    @Test
    void shouldLoadFromFile() throws Exception {
        Path file = tempDir.resolve("doks.yml");
        Files.writeString(file, """
                sources:
                  - source: filesystem
                    id: local
                    paths: [/tmp/docs]
                """);

        AppConfig config = AppConfig.load(file);

        assertEquals("local", config.getSources().get(0).getId());
    }

    @Test
    void shouldFailForMissingFile() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> AppConfig.load(tempDir.resolve("absent.yml")));

        assertTrue(error.getMessage().startsWith("Config file not found"));
    }
}
