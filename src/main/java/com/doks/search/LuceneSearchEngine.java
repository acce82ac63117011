package com.doks.search;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.queryparser.classic.MultiFieldQueryParser;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherFactory;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.highlight.Highlighter;
import org.apache.lucene.search.highlight.InvalidTokenOffsetsException;
import org.apache.lucene.search.highlight.QueryScorer;
import org.apache.lucene.search.highlight.SimpleHTMLFormatter;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.doks.sources.Document;
import com.doks.stream.ChannelStream;
import com.doks.stream.NamedThreadFactory;

/**
 * Lucene-backed index. Writes are queued on a single writer thread and serialized by a fair lock, so
 * commits happen in the order {@link #index} was invoked. Searches run on shared reader snapshots that
 * only see committed documents and are refreshed according to the configured {@link RefreshPolicy}.
 */
public class LuceneSearchEngine implements SearchEngine {
    private static final Logger log = LoggerFactory.getLogger(LuceneSearchEngine.class);

    public static final int TOP_K = 10;
    static final String FIELD_UID = "_uid";
    static final String FIELD_ID = "id";
    static final String FIELD_SOURCE = "source";
    static final String FIELD_TITLE = "title";
    static final String FIELD_LINK = "link";
    static final String FIELD_CONTENT = "content";
    private static final String[] DEFAULT_FIELDS = { FIELD_TITLE, FIELD_CONTENT };
    private static final int SNIPPET_LENGTH = 240;

    private final Path indexPath;
    private final Directory directory;
    private final Analyzer analyzer;
    private final IndexWriter writer;
    private final SearcherManager searcherManager;
    private final RefreshPolicy refreshPolicy;
    private final ReentrantLock writeLock = new ReentrantLock(true);
    private final ExecutorService writerExecutor;
    private final ScheduledExecutorService refresher;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public LuceneSearchEngine(Path indexPath) throws IOException {
        this(indexPath, RefreshPolicy.ON_COMMIT, Duration.ofSeconds(1), 64);
    }

    public LuceneSearchEngine(Path indexPath, RefreshPolicy refreshPolicy, Duration refreshInterval, double ramBufferMb)
            throws IOException {
        Files.createDirectories(indexPath);
        this.indexPath = indexPath;
        this.refreshPolicy = refreshPolicy;
        this.directory = FSDirectory.open(indexPath);
        this.analyzer = new StandardAnalyzer();
        IndexWriterConfig config = new IndexWriterConfig(analyzer)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND)
                .setRAMBufferSizeMB(ramBufferMb);
        this.writer = new IndexWriter(directory, config);
        // readers open on the last commit, so an empty index needs one
        writer.commit();
        this.searcherManager = new SearcherManager(directory, new SearcherFactory());
        this.writerExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory("doks-index-writer"));
        if (refreshPolicy == RefreshPolicy.PERIODIC) {
            this.refresher = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("doks-index-refresh"));
            long intervalMs = Math.max(1L, refreshInterval.toMillis());
            refresher.scheduleWithFixedDelay(this::refreshQuietly, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        } else {
            this.refresher = null;
        }
        log.info("Opened Lucene index at {} refreshPolicy={} documents={}", indexPath, refreshPolicy, writer.getDocStats().numDocs);
    }

    @Override
    public void index(List<Document> documents) throws IOException {
        await(indexAsync(documents));
    }

    public CompletableFuture<Void> indexAsync(List<Document> documents) {
        ensureOpen();
        List<Document> batch = List.copyOf(documents);
        return CompletableFuture.runAsync(() -> write(() -> {
            for (Document document : batch) {
                writer.updateDocument(new Term(FIELD_UID, uid(document.source(), document.id())), toLucene(document));
            }
            writer.commit();
            log.debug("Committed {} documents to {}", batch.size(), indexPath);
        }), writerExecutor);
    }

    @Override
    public ChannelStream<FoundItem> search(String query) {
        ensureOpen();
        return ChannelStream.open(sender -> {
            Query parsed = parse(query);
            IndexSearcher searcher = searcherManager.acquire();
            try {
                TopDocs topDocs = searcher.search(parsed, TOP_K);
                StoredFields storedFields = searcher.storedFields();
                log.debug("Query '{}' matched {} documents", query, topDocs.totalHits);
                for (ScoreDoc hit : topDocs.scoreDocs) {
                    sender.send(toFoundItem(storedFields.document(hit.doc), hit.score, parsed));
                }
            } finally {
                searcherManager.release(searcher);
            }
        });
    }

    @Override
    public void purge() throws IOException {
        ensureOpen();
        await(CompletableFuture.runAsync(() -> write(() -> {
            writer.deleteAll();
            writer.commit();
            log.info("Purged every document from {}", indexPath);
        }), writerExecutor));
    }

    public void refresh() throws IOException {
        ensureOpen();
        searcherManager.maybeRefreshBlocking();
    }

    public RefreshPolicy refreshPolicy() {
        return refreshPolicy;
    }

    @Override
    public void close() throws IOException {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (refresher != null) {
            refresher.shutdownNow();
        }
        writerExecutor.shutdown();
        try {
            if (!writerExecutor.awaitTermination(1, TimeUnit.MINUTES)) {
                log.warn("Index writer did not finish pending writes within one minute");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        writeLock.lock();
        try {
            searcherManager.close();
            writer.close();
            directory.close();
            analyzer.close();
        } finally {
            writeLock.unlock();
        }
        log.info("Closed Lucene index at {}", indexPath);
    }

    private void write(WriteAction action) {
        writeLock.lock();
        try {
            action.run();
            if (refreshPolicy == RefreshPolicy.ON_COMMIT) {
                searcherManager.maybeRefreshBlocking();
            }
        } catch (IOException e) {
            log.error("Index write failed for {}", indexPath, e);
            throw new UncheckedIOException(e);
        } finally {
            writeLock.unlock();
        }
    }

    private void refreshQuietly() {
        try {
            searcherManager.maybeRefresh();
        } catch (IOException e) {
            log.warn("Periodic reader refresh failed for {}", indexPath, e);
        }
    }

    private Query parse(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        try {
            return new MultiFieldQueryParser(DEFAULT_FIELDS, analyzer).parse(query);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid query '" + query + "': " + e.getMessage(), e);
        }
    }

    private FoundItem toFoundItem(org.apache.lucene.document.Document stored, float score, Query query) throws IOException {
        String content = stored.get(FIELD_CONTENT);
        return new FoundItem(
                stored.get(FIELD_ID),
                score,
                stored.get(FIELD_SOURCE),
                stored.get(FIELD_TITLE),
                stored.get(FIELD_LINK),
                snippet(query, content == null ? "" : content));
    }

    String snippet(Query query, String content) throws IOException {
        Highlighter highlighter = new Highlighter(new SimpleHTMLFormatter("", ""), new QueryScorer(query, FIELD_CONTENT));
        String fragment = null;
        try {
            fragment = highlighter.getBestFragment(analyzer, FIELD_CONTENT, content);
        } catch (InvalidTokenOffsetsException e) {
            log.debug("Unable to highlight content, using its beginning as snippet", e);
        }
        String snippet = fragment == null || fragment.isBlank() ? content : fragment;
        snippet = snippet.strip().replaceAll("\\s+", " ");
        if (snippet.length() > SNIPPET_LENGTH) {
            int end = SNIPPET_LENGTH;
            // never split a surrogate pair
            if (Character.isHighSurrogate(snippet.charAt(end - 1))) {
                end--;
            }
            snippet = snippet.substring(0, end) + "...";
        }
        return snippet;
    }

    private static org.apache.lucene.document.Document toLucene(Document document) {
        org.apache.lucene.document.Document converted = new org.apache.lucene.document.Document();
        converted.add(new StringField(FIELD_UID, uid(document.source(), document.id()), Field.Store.NO));
        converted.add(new StringField(FIELD_ID, document.id(), Field.Store.YES));
        converted.add(new StringField(FIELD_SOURCE, document.source(), Field.Store.YES));
        converted.add(new TextField(FIELD_TITLE, document.title(), Field.Store.YES));
        converted.add(new StringField(FIELD_LINK, document.link(), Field.Store.YES));
        converted.add(new TextField(FIELD_CONTENT, document.content(), Field.Store.YES));
        return converted;
    }

    static String uid(String source, String id) {
        return source + '\u0000' + id;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("search engine at " + indexPath + " is closed");
        }
    }

    private static void await(CompletableFuture<Void> future) throws IOException {
        try {
            future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UncheckedIOException unchecked) {
                throw unchecked.getCause();
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IOException("Index write failed", cause);
        }
    }

    @FunctionalInterface
    private interface WriteAction {
        void run() throws IOException;
    }
}
