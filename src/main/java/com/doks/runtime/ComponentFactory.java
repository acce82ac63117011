package com.doks.runtime;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.doks.git.CompositeRepositoryLister;
import com.doks.git.GitRepositoryManager;
import com.doks.git.GithubGraphQlClient;
import com.doks.git.GithubSearchRepositoryLister;
import com.doks.git.GithubStarredRepositoryLister;
import com.doks.git.RepositoryDescriptor;
import com.doks.git.RepositoryLister;
import com.doks.git.StaticRepositoryLister;
import com.doks.search.LuceneSearchEngine;
import com.doks.search.SearchEngine;
import com.doks.sources.DocumentSource;
import com.doks.sources.FileSystemDocumentSource;
import com.doks.sources.GitRepositorySource;
import com.doks.sources.PathFilter;

import okhttp3.OkHttpClient;

public class ComponentFactory {
    private static final Logger log = LoggerFactory.getLogger(ComponentFactory.class);

    private final OkHttpClient httpClient;
    private final GitRepositoryManager repositoryManager;

    public ComponentFactory(OkHttpClient httpClient, GitRepositoryManager repositoryManager) {
        this.httpClient = httpClient;
        this.repositoryManager = repositoryManager;
    }

    public static ComponentFactory fromConfig(AppConfig config, OkHttpClient httpClient) {
        AppConfig.GitConfig git = config.getGit();
        Path workRoot = git.getWorkspacePath() == null || git.getWorkspacePath().isBlank()
                ? null
                : resolvePath(git.getWorkspacePath());
        GitRepositoryManager manager = new GitRepositoryManager(Duration.ofSeconds(git.getCloneTimeoutSeconds()), workRoot);
        return new ComponentFactory(httpClient, manager);
    }

    public SearchEngine createSearchEngine(AppConfig.EngineConfig engine, String namespace) throws IOException {
        if (engine.getPath() == null || engine.getPath().isBlank()) {
            throw new IllegalArgumentException("engine.path must not be blank");
        }
        if (namespace == null || namespace.isBlank() || namespace.contains("/") || namespace.contains("\\") || namespace.startsWith(".")) {
            throw new IllegalArgumentException("Invalid namespace '" + namespace + "'");
        }
        Path indexPath = resolvePath(engine.getPath()).resolve(namespace);
        return new LuceneSearchEngine(indexPath,
                engine.getRefreshPolicy(),
                Duration.ofMillis(engine.getRefreshIntervalMs()),
                engine.getRamBufferMb());
    }

    public List<DocumentSource> createSources(List<AppConfig.SourceConfig> configs) throws IOException {
        Set<String> ids = new HashSet<>();
        List<DocumentSource> sources = new ArrayList<>();
        for (AppConfig.SourceConfig config : configs) {
            if (config.getId() == null || config.getId().isBlank()) {
                throw new IllegalArgumentException("Every source needs a non-blank 'id'");
            }
            if (!ids.add(config.getId())) {
                throw new IllegalArgumentException("Duplicate source id '" + config.getId() + "'");
            }
            sources.add(createSource(config));
        }
        return sources;
    }

    public DocumentSource createSource(AppConfig.SourceConfig config) throws IOException {
        PathFilter filter = PathFilter.compile(config.getInclude(), config.getExclude());
        if (config instanceof AppConfig.FileSystemSourceConfig fileSystem) {
            if (fileSystem.getPaths().isEmpty()) {
                throw new IllegalArgumentException("Source '" + config.getId() + "' needs at least one path");
            }
            List<Path> roots = fileSystem.getPaths().stream().map(ComponentFactory::resolvePath).toList();
            log.debug("Configured filesystem source '{}' roots={} filter={}", config.getId(), roots, filter);
            return new FileSystemDocumentSource(config.getId(), roots, filter);
        }
        if (config instanceof AppConfig.GithubSourceConfig github) {
            if (github.getRepositories() == null) {
                throw new IllegalArgumentException("Source '" + config.getId() + "' needs a 'repositories' section");
            }
            RepositoryLister lister = createLister(github.getRepositories());
            log.debug("Configured git source '{}' lister={} filter={}", config.getId(), lister.getClass().getSimpleName(), filter);
            return new GitRepositorySource(config.getId(), lister, filter, repositoryManager);
        }
        throw new IllegalArgumentException("Unsupported source type " + config.getClass().getSimpleName());
    }

    public RepositoryLister createLister(AppConfig.RepositoriesConfig config) throws IOException {
        if (config instanceof AppConfig.ListRepositoriesConfig list) {
            List<RepositoryDescriptor> repositories = new ArrayList<>();
            for (AppConfig.RepositoryEntry entry : list.getList()) {
                if (entry.getName() == null || entry.getName().isBlank()) {
                    throw new IllegalArgumentException("Every listed repository needs a 'name'");
                }
                repositories.add(new RepositoryDescriptor(
                        entry.getName(),
                        list.getTransport().cloneUrl(list.getServer(), entry.getName()),
                        entry.getBranch(),
                        entry.getFolder()));
            }
            return new StaticRepositoryLister(repositories);
        }
        if (config instanceof AppConfig.ApiRepositoriesConfig api) {
            GithubGraphQlClient client = new GithubGraphQlClient(httpClient, api.getEndpoint(), readToken(api.getTokenFile()));
            List<RepositoryLister> listers = new ArrayList<>();
            for (String login : api.getStarredBy()) {
                listers.add(new GithubStarredRepositoryLister(client, login, api.getPageSize(), api.getTransport()));
            }
            if (api.getSearch() != null && !api.getSearch().isBlank()) {
                listers.add(new GithubSearchRepositoryLister(client, api.getSearch(), api.getPageSize(), api.getTransport()));
            }
            if (listers.isEmpty()) {
                throw new IllegalArgumentException("Repositories from 'api' need 'search' or 'starred_by'");
            }
            return listers.size() == 1 ? listers.get(0) : new CompositeRepositoryLister(listers);
        }
        throw new IllegalArgumentException("Unsupported repositories type " + config.getClass().getSimpleName());
    }

    private static String readToken(String tokenFile) throws IOException {
        if (tokenFile == null || tokenFile.isBlank()) {
            return null;
        }
        return Files.readString(resolvePath(tokenFile), StandardCharsets.UTF_8).strip();
    }

    static Path resolvePath(String configured) {
        if (configured.equals("~")) {
            return Path.of(System.getProperty("user.home"));
        }
        if (configured.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(configured.substring(2));
        }
        return Path.of(configured);
    }
}
