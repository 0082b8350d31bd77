package com.coinpulse.core.feed;

import com.coinpulse.core.http.FetchOutcome;
import com.coinpulse.core.http.HttpFetcher;
import com.coinpulse.core.model.NormalizedArticle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches several feeds on a bounded worker pool and merges them in source order.
 *
 * Each source is capped at {@code limit / sourceCount} articles, then the merged list
 * is trimmed to {@code limit}. A source that times out, answers non-200 or serves
 * malformed XML is logged and skipped; the others are unaffected.
 */
public class FeedAggregator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FeedAggregator.class);

    private final HttpFetcher fetcher;
    private final FeedNormalizer normalizer;
    private final Duration feedTimeout;
    private final ExecutorService workers;

    public FeedAggregator(HttpFetcher fetcher, FeedNormalizer normalizer, Duration feedTimeout, int workerCount) {
        this.fetcher = fetcher;
        this.normalizer = normalizer;
        this.feedTimeout = feedTimeout;
        AtomicInteger threadIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, workerCount), r -> {
            Thread t = new Thread(r, "feed-fetcher-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public FetchOutcome<List<NormalizedArticle>> collect(List<FeedSource> sources, int limit) {
        if (sources.isEmpty() || limit <= 0) {
            return FetchOutcome.empty(List.of(), "nothing to fetch");
        }

        int perSource = limit / sources.size();
        if (perSource == 0) {
            log.debug("Article limit {} is below the source count {}, nothing to extract", limit, sources.size());
            return FetchOutcome.empty(List.of(), "limit below source count");
        }

        // Submit in source order; collecting in the same order keeps output independent of completion order
        List<Future<List<NormalizedArticle>>> futures = new ArrayList<>(sources.size());
        for (FeedSource source : sources) {
            futures.add(workers.submit(() -> fetchSource(source, perSource)));
        }

        List<NormalizedArticle> all = new ArrayList<>();
        int failed = 0;
        for (int i = 0; i < futures.size(); i++) {
            FeedSource source = sources.get(i);
            try {
                all.addAll(futures.get(i).get());
            } catch (ExecutionException e) {
                failed++;
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Error parsing RSS {}: {}", source.url(), cause.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while collecting feeds, returning {} articles", all.size());
                futures.forEach(f -> f.cancel(true));
                return FetchOutcome.partial(trim(all, limit), "interrupted");
            }
        }

        List<NormalizedArticle> result = trim(all, limit);
        log.info("Collected {} articles from {} feeds ({} failed)", result.size(), sources.size(), failed);

        if (result.isEmpty()) {
            return FetchOutcome.empty(List.of(), failed + " of " + sources.size() + " feeds failed");
        }
        if (failed > 0) {
            return FetchOutcome.partial(result, failed + " of " + sources.size() + " feeds failed");
        }
        return FetchOutcome.data(result);
    }

    private List<NormalizedArticle> fetchSource(FeedSource source, int maxItems) throws FeedParseException {
        FetchOutcome<byte[]> payload = fetcher.fetchBytes(source.url(), feedTimeout);
        if (!payload.hasData()) {
            throw new FeedParseException("Feed unavailable: " + payload.detail());
        }
        List<NormalizedArticle> articles = normalizer.parse(payload.value(), source.domain(), maxItems);
        log.debug("Fetched {} articles from {}", articles.size(), source.id());
        return articles;
    }

    private static List<NormalizedArticle> trim(List<NormalizedArticle> articles, int limit) {
        return List.copyOf(articles.size() > limit ? articles.subList(0, limit) : articles);
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }
}
