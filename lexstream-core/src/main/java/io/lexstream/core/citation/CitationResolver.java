package io.lexstream.core.citation;

import io.lexstream.core.model.CitationFragment;
import io.lexstream.core.model.Source;
import io.lexstream.core.model.SourceList;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves citation links to their destination pages.
 *
 * <p>The probe-free {@link RedirectHeuristics} run first, in order, and the first hit wins.
 * Redirect links none of them can unwrap go to the {@link RedirectProbe}; when that fails
 * too the original link is kept as is. Each probe's timeout counts from when a worker
 * starts it.
 */
public final class CitationResolver implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(CitationResolver.class);
    private static final AtomicInteger THREAD_IDS = new AtomicInteger();

    private final RedirectMarkers markers;
    private final List<UrlHeuristic> heuristics;
    private final RedirectProbe probe;
    private final Duration resolveTimeout;
    private final ExecutorService executor;

    public CitationResolver(RedirectMarkers markers, RedirectProbe probe, int maxConcurrentProbes, Duration resolveTimeout) {
        this.markers = Objects.requireNonNull(markers, "markers must not be null");
        this.heuristics = new RedirectHeuristics(markers).chain();
        this.probe = Objects.requireNonNull(probe, "probe must not be null");
        this.resolveTimeout = Objects.requireNonNull(resolveTimeout, "resolveTimeout must not be null");
        this.executor = Executors.newFixedThreadPool(Math.max(1, maxConcurrentProbes), runnable -> {
            Thread thread = new Thread(runnable, "citation-probe-" + THREAD_IDS.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public Optional<String> resolveOffline(String uri) {
        if (uri == null || uri.isBlank()) {
            return Optional.empty();
        }
        return UrlHeuristic.firstSuccess(heuristics, uri.trim());
    }

    public String resolveUrl(String uri) {
        Optional<String> offline = resolveOffline(uri);
        if (offline.isPresent()) {
            return offline.get();
        }
        if (!markers.isRedirect(uri)) {
            return uri;
        }
        return probe.follow(uri.trim()).orElse(uri);
    }

    public CompletableFuture<Source> resolve(CitationFragment fragment) {
        return resolve(Source.of(fragment.title(), fragment.uri(), fragment.snippet()));
    }

    public CompletableFuture<Source> resolve(Source source) {
        Optional<String> offline = resolveOffline(source.url());
        if (offline.isPresent()) {
            return CompletableFuture.completedFuture(rewrite(source, offline.get()));
        }
        if (!markers.isRedirect(source.url())) {
            return CompletableFuture.completedFuture(source);
        }
        CompletableFuture<Source> result = new CompletableFuture<>();
        try {
            executor.execute(() -> probeInto(result, source));
        } catch (RejectedExecutionException e) {
            LOG.warn("Resolver closed, keeping redirect link for '{}'", source.title());
            result.complete(source);
        }
        return result;
    }

    // The deadline starts once a worker picks the source up, not while it waits in the queue.
    private void probeInto(CompletableFuture<Source> result, Source source) {
        if (result.isDone()) {
            return;
        }
        result.completeOnTimeout(source, resolveTimeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            result.complete(probe.follow(source.url()).map(url -> rewrite(source, url)).orElse(source));
        } catch (RuntimeException e) {
            LOG.warn("Resolution of '{}' failed: {}", source.title(), e.getMessage());
            result.complete(source);
        }
    }

    public List<Source> resolveAll(List<Source> sources) {
        List<CompletableFuture<Source>> pending = new ArrayList<>(sources.size());
        for (Source source : sources) {
            pending.add(resolve(source));
        }
        CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0])).join();

        List<Source> resolved = new ArrayList<>(pending.size());
        for (CompletableFuture<Source> future : pending) {
            resolved.add(future.join());
        }
        long stillRedirects = resolved.stream().filter(source -> markers.isRedirect(source.url())).count();
        if (stillRedirects > 0) {
            LOG.info("{} citation link(s) kept as redirect links", stillRedirects);
        }
        return SourceList.deduplicate(resolved);
    }

    private Source rewrite(Source source, String url) {
        return url.equals(source.url()) ? source : source.withUrl(url);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
