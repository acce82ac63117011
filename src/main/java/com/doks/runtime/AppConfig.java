package com.doks.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.doks.git.GitCloneTransport;
import com.doks.search.RefreshPolicy;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private List<SourceConfig> sources = new ArrayList<>();
    private EngineConfig engine = new EngineConfig();
    private IngestionConfig ingestion = new IngestionConfig();
    private GitConfig git = new GitConfig();

    public static AppConfig load(Path config) throws IOException {
        if (!Files.exists(config)) {
            throw new IllegalArgumentException("Config file not found: " + config.toAbsolutePath().normalize());
        }
        return mapper().readValue(config.toFile(), AppConfig.class);
    }

    public static AppConfig parse(String content) throws IOException {
        return mapper().readValue(content, AppConfig.class);
    }

    // YAML is a superset of JSON, so both formats load through the same mapper
    private static ObjectMapper mapper() {
        return JsonMapper.builder(new YAMLFactory())
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
                .build();
    }

    public List<SourceConfig> getSources() {
        return sources;
    }

    public void setSources(List<SourceConfig> sources) {
        this.sources = sources == null ? new ArrayList<>() : sources;
    }

    public EngineConfig getEngine() {
        return engine;
    }

    public void setEngine(EngineConfig engine) {
        this.engine = engine == null ? new EngineConfig() : engine;
    }

    public IngestionConfig getIngestion() {
        return ingestion;
    }

    public void setIngestion(IngestionConfig ingestion) {
        this.ingestion = ingestion == null ? new IngestionConfig() : ingestion;
    }

    public GitConfig getGit() {
        return git;
    }

    public void setGit(GitConfig git) {
        this.git = git == null ? new GitConfig() : git;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "source")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = FileSystemSourceConfig.class, names = { "fs", "filesystem", "FileSystem" }),
            @JsonSubTypes.Type(value = GithubSourceConfig.class, names = { "github", "Github" })
    })
    public abstract static class SourceConfig {
        private String id;
        private List<String> include = new ArrayList<>();
        private List<String> exclude = new ArrayList<>();

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public List<String> getInclude() {
            return include;
        }

        public void setInclude(List<String> include) {
            this.include = include == null ? new ArrayList<>() : include;
        }

        public List<String> getExclude() {
            return exclude;
        }

        public void setExclude(List<String> exclude) {
            this.exclude = exclude == null ? new ArrayList<>() : exclude;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FileSystemSourceConfig extends SourceConfig {
        private List<String> paths = new ArrayList<>();

        public List<String> getPaths() {
            return paths;
        }

        public void setPaths(List<String> paths) {
            this.paths = paths == null ? new ArrayList<>() : paths;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GithubSourceConfig extends SourceConfig {
        private RepositoriesConfig repositories;

        public RepositoriesConfig getRepositories() {
            return repositories;
        }

        public void setRepositories(RepositoriesConfig repositories) {
            this.repositories = repositories;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "from")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = ListRepositoriesConfig.class, names = { "list", "FromList" }),
            @JsonSubTypes.Type(value = ApiRepositoriesConfig.class, names = { "api", "FromApi" })
    })
    public abstract static class RepositoriesConfig {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ListRepositoriesConfig extends RepositoriesConfig {
        private String server = "github.com";
        private GitCloneTransport transport = GitCloneTransport.SSH;
        private List<RepositoryEntry> list = new ArrayList<>();

        public String getServer() {
            return server;
        }

        public void setServer(String server) {
            this.server = server == null || server.isBlank() ? "github.com" : server;
        }

        public GitCloneTransport getTransport() {
            return transport;
        }

        public void setTransport(GitCloneTransport transport) {
            this.transport = transport == null ? GitCloneTransport.SSH : transport;
        }

        public List<RepositoryEntry> getList() {
            return list;
        }

        public void setList(List<RepositoryEntry> list) {
            this.list = list == null ? new ArrayList<>() : list;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RepositoryEntry {
        private String name;
        private String folder;
        private String branch;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getFolder() {
            return folder;
        }

        public void setFolder(String folder) {
            this.folder = folder;
        }

        public String getBranch() {
            return branch;
        }

        public void setBranch(String branch) {
            this.branch = branch;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiRepositoriesConfig extends RepositoriesConfig {
        private String search;
        @JsonAlias("starred_by")
        private List<String> starredBy = new ArrayList<>();
        private String endpoint;
        @JsonAlias("token_file")
        private String tokenFile;
        private GitCloneTransport transport = GitCloneTransport.HTTPS;
        private int pageSize = 50;

        public String getSearch() {
            return search;
        }

        public void setSearch(String search) {
            this.search = search;
        }

        public List<String> getStarredBy() {
            return starredBy;
        }

        public void setStarredBy(List<String> starredBy) {
            this.starredBy = starredBy == null ? new ArrayList<>() : starredBy;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getTokenFile() {
            return tokenFile;
        }

        public void setTokenFile(String tokenFile) {
            this.tokenFile = tokenFile;
        }

        public GitCloneTransport getTransport() {
            return transport;
        }

        public void setTransport(GitCloneTransport transport) {
            this.transport = transport == null ? GitCloneTransport.HTTPS : transport;
        }

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EngineConfig {
        private String path = "/tmp/doks_index";
        private RefreshPolicy refreshPolicy = RefreshPolicy.ON_COMMIT;
        private long refreshIntervalMs = 1000;
        private double ramBufferMb = 64;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public RefreshPolicy getRefreshPolicy() {
            return refreshPolicy;
        }

        public void setRefreshPolicy(RefreshPolicy refreshPolicy) {
            this.refreshPolicy = refreshPolicy == null ? RefreshPolicy.ON_COMMIT : refreshPolicy;
        }

        public long getRefreshIntervalMs() {
            return refreshIntervalMs;
        }

        public void setRefreshIntervalMs(long refreshIntervalMs) {
            this.refreshIntervalMs = refreshIntervalMs;
        }

        public double getRamBufferMb() {
            return ramBufferMb;
        }

        public void setRamBufferMb(double ramBufferMb) {
            this.ramBufferMb = ramBufferMb;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestionConfig {
        private int batchSize = 10;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GitConfig {
        private int cloneTimeoutSeconds = 300;
        private String workspacePath;

        public int getCloneTimeoutSeconds() {
            return cloneTimeoutSeconds;
        }

        public void setCloneTimeoutSeconds(int cloneTimeoutSeconds) {
            this.cloneTimeoutSeconds = cloneTimeoutSeconds;
        }

        public String getWorkspacePath() {
            return workspacePath;
        }

        public void setWorkspacePath(String workspacePath) {
            this.workspacePath = workspacePath;
        }
    }
}
