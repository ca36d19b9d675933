package com.mangaku.scraper.scrape.aggregate;

import com.fasterxml.jackson.databind.JsonNode;
import com.mangaku.scraper.config.ScraperProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Collects the image list of every mirror on a reader page in parallel.
 *
 * <p>Each call runs on its own short-lived pool. The result always holds one entry per
 * dispatched source, labelled {@code Server 1}..{@code Server N}; a source that fails or
 * misses its deadline maps to an empty list.
 */
@Component
public class MirrorImageAggregator {
    private static final Logger log = LoggerFactory.getLogger(MirrorImageAggregator.class);
    private static final String LABEL_PREFIX = "Server ";
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final int maxSources;
    private final Duration taskTimeout;
    private final Duration overallTimeout;

    public MirrorImageAggregator(ScraperProperties properties) {
        ScraperProperties.Aggregation aggregation = properties.getAggregation();
        this.maxSources = aggregation.getMaxSources();
        this.taskTimeout = aggregation.getTaskTimeout();
        this.overallTimeout = aggregation.getOverallTimeout();
    }

    public Map<String, List<String>> aggregate(List<JsonNode> sources) {
        return aggregate(sources, MirrorImageAggregator::imagesOf);
    }

    public <T> Map<String, List<String>> aggregate(List<T> sources, Function<? super T, List<String>> imageLister) {
        Map<String, List<String>> servers = new LinkedHashMap<>();
        if (sources == null || sources.isEmpty()) {
            return servers;
        }
        int count = Math.min(maxSources, sources.size());
        ExecutorService executor = Executors.newFixedThreadPool(count, threadFactory());
        try {
            long startedAt = System.nanoTime();
            List<Future<List<String>>> futures = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                T source = sources.get(i);
                futures.add(executor.submit(() -> imageLister.apply(source)));
            }
            long taskDeadline = startedAt + taskTimeout.toNanos();
            long overallDeadline = startedAt + overallTimeout.toNanos();
            long deadline = Math.min(taskDeadline, overallDeadline);
            for (int i = 0; i < count; i++) {
                String label = label(i + 1);
                servers.put(label, await(label, futures.get(i), deadline));
            }
        } finally {
            executor.shutdownNow();
        }
        return servers;
    }

    public static String label(int ordinal) {
        return LABEL_PREFIX + ordinal;
    }

    static List<String> imagesOf(JsonNode source) {
        JsonNode images = source == null ? null : source.get("images");
        if (images == null || !images.isArray()) {
            throw new IllegalStateException("mirror source has no images array");
        }
        List<String> urls = new ArrayList<>();
        for (JsonNode image : images) {
            if (image.isTextual()) {
                urls.add(image.asText());
            }
        }
        return urls;
    }

    private List<String> await(String label, Future<List<String>> future, long deadlineNanos) {
        long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
        try {
            return clean(future.get(remaining, TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} did not finish within {}, using empty image list", label, taskTimeout);
            return List.of();
        } catch (ExecutionException e) {
            log.warn("{} failed, using empty image list", label, e.getCause());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Interrupted while waiting for {}, using empty image list", label);
            return List.of();
        }
    }

    private static List<String> clean(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            return List.of();
        }
        List<String> cleaned = new ArrayList<>(urls.size());
        for (String url : urls) {
            if (url != null && !url.isBlank()) {
                cleaned.add(url.trim());
            }
        }
        return Collections.unmodifiableList(cleaned);
    }

    private static ThreadFactory threadFactory() {
        int pool = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger threadIndex = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "mirror-aggregate-" + pool + "-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
