package com.doks;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.doks.ingest.IngestionReport;
import com.doks.ingest.IngestionService;
import com.doks.runtime.AppConfig;
import com.doks.runtime.ComponentFactory;
import com.doks.search.FoundItem;
import com.doks.search.SearchEngine;
import com.doks.sources.DocumentSource;
import com.doks.stream.ChannelStream;
import com.doks.stream.StreamException;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
        name = "doks",
        mixinStandardHelpOptions = true,
        version = "doks 0.1.0",
        description = "Indexes documents from local folders and git repositories, then searches them.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE_ERROR = 2;

    @Option(names = { "-c", "--config" }, description = "Path to the YAML or JSON config file", required = true)
    Path configPath;

    @Option(names = { "-n", "--namespace" }, description = "Index namespace under the engine path", defaultValue = "default")
    String namespace;

    @Parameters(index = "0", description = "Command to run: ${COMPLETION-CANDIDATES}")
    Mode mode;

    @Parameters(index = "1", arity = "0..1", description = "Query text for the search command")
    String query;

    private final OkHttpClient httpClient;
    private final PrintStream out;
    private final ObjectMapper mapper = new ObjectMapper();

    enum Mode {
        index,
        search,
        purge
    }

    public Main() {
        this(new OkHttpClient(), System.out);
    }

    Main(OkHttpClient httpClient, PrintStream out) {
        this.httpClient = httpClient;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        AppConfig config;
        try {
            config = AppConfig.load(configPath);
        } catch (IllegalArgumentException | IOException e) {
            log.error("Unable to load config {}: {}", configPath, e.getMessage());
            return EXIT_USAGE_ERROR;
        }
        log.info("Starting doks {} with config {} namespace={}", mode, configPath, namespace);

        ComponentFactory factory = createComponentFactory(config);
        try {
            return switch (mode) {
                case index -> runIndex(factory, config);
                case search -> runSearch(factory, config);
                case purge -> runPurge(factory, config);
            };
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE_ERROR;
        } catch (IOException e) {
            log.error("doks {} failed: {}", mode, e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    ComponentFactory createComponentFactory(AppConfig config) {
        return ComponentFactory.fromConfig(config, httpClient);
    }

    IngestionService createIngestionService(SearchEngine engine, AppConfig config) {
        return new IngestionService(engine, config.getIngestion().getBatchSize());
    }

    private int runIndex(ComponentFactory factory, AppConfig config) throws IOException {
        List<DocumentSource> sources = factory.createSources(config.getSources());
        if (sources.isEmpty()) {
            log.warn("No sources configured in {}", configPath);
        }
        try (SearchEngine engine = factory.createSearchEngine(config.getEngine(), namespace)) {
            IngestionReport report = createIngestionService(engine, config).ingest(sources);
            log.info("Indexing finished sources={} batches={} documents={}",
                    report.sources(),
                    report.batches(),
                    report.documents());
        }
        return EXIT_OK;
    }

    private int runSearch(ComponentFactory factory, AppConfig config) throws IOException {
        if (query == null || query.isBlank()) {
            log.error("a query is required by the search command");
            return EXIT_USAGE_ERROR;
        }
        try (SearchEngine engine = factory.createSearchEngine(config.getEngine(), namespace);
                ChannelStream<FoundItem> results = engine.search(query)) {
            int count = 0;
            while (results.hasNext()) {
                out.println(mapper.writeValueAsString(results.next()));
                count++;
            }
            log.info("Search '{}' returned {} results", query, count);
        } catch (StreamException e) {
            if (e.getCause() instanceof IllegalArgumentException invalid) {
                log.error("{}", invalid.getMessage());
                return EXIT_USAGE_ERROR;
            }
            throw e.asIOException("Search '" + query + "' failed");
        }
        return EXIT_OK;
    }

    private int runPurge(ComponentFactory factory, AppConfig config) throws IOException {
        try (SearchEngine engine = factory.createSearchEngine(config.getEngine(), namespace)) {
            engine.purge();
        }
        log.info("Purged namespace {}", namespace);
        return EXIT_OK;
    }
}
