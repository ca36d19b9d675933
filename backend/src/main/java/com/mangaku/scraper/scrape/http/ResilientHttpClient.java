package com.mangaku.scraper.scrape.http;

import com.mangaku.scraper.config.ScraperProperties;
import com.mangaku.scraper.scrape.metrics.ScraperMetrics;
import com.mangaku.scraper.scrape.model.FetchFailureKind;
import com.mangaku.scraper.scrape.model.FetchRequest;
import com.mangaku.scraper.scrape.model.FetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * GET-only transport for upstream pages.
 *
 * <p>Transient statuses are retried with exponential backoff. A read timeout on the normal
 * profile gets exactly one more try on the escalated profile (longer connect and read
 * timeouts); connect timeouts and other I/O failures are returned straight away.
 */
@Service
public class ResilientHttpClient {
    private static final Logger log = LoggerFactory.getLogger(ResilientHttpClient.class);
    static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504, 520, 521, 522, 523, 524);
    private static final String ACCEPT_HTML = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final ScraperProperties properties;
    private final ScraperMetrics metrics;
    private final HttpClient fastClient;
    private final HttpClient escalatedClient;
    private final Semaphore globalLimiter;
    private final Map<String, Semaphore> hostLimiters = new ConcurrentHashMap<>();

    public ResilientHttpClient(
        ScraperProperties properties,
        @Qualifier("scraperHttpExecutor") ExecutorService httpExecutor,
        ScraperMetrics metrics
    ) {
        this.properties = properties;
        this.metrics = metrics;
        ScraperProperties.Http http = properties.getHttp();
        SSLContext sslContext = TlsTrustPolicy.sslContext(http.isTrustAllCertificates());
        this.fastClient = buildClient(http.getConnectTimeout(), sslContext, httpExecutor);
        this.escalatedClient = buildClient(http.getEscalatedConnectTimeout(), sslContext, httpExecutor);
        this.globalLimiter = new Semaphore(http.getPoolMaxSize());
    }

    public FetchResult get(String url) {
        return fetch(FetchRequest.of(url, properties.getHttp()));
    }

    public FetchResult fetch(FetchRequest request) {
        URI uri = normalizeUri(request.url());
        if (uri == null || uri.getHost() == null) {
            return FetchResult.failure(
                request.url(),
                Instant.now(),
                FetchFailureKind.INVALID_URL,
                "URL missing host or malformed",
                0
            );
        }

        FetchResult result = sendWithRetries(request, uri, fastClient, request.timeout(), 0);
        if (result.failureKind() != FetchFailureKind.READ_TIMEOUT) {
            return result;
        }

        Duration escalatedTimeout = properties.getHttp().getEscalatedReadTimeout();
        log.info(
            "Read timeout on {} after {} attempt(s), escalating once with read timeout {}",
            request.url(),
            result.attempts(),
            escalatedTimeout
        );
        FetchResult escalated = sendWithRetries(request, uri, escalatedClient, escalatedTimeout, result.attempts());
        if (escalated.isFailure()) {
            log.warn(
                "Escalated fetch of {} failed with {}: {}",
                request.url(),
                escalated.failureKind(),
                escalated.errorMessage()
            );
        }
        return escalated;
    }

    private FetchResult sendWithRetries(
        FetchRequest request,
        URI uri,
        HttpClient client,
        Duration readTimeout,
        int priorAttempts
    ) {
        int maxAttempts = 1 + request.maxRetries();
        int attempts = priorAttempts;
        FetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            attempts++;
            lastResult = executeOnce(request.url(), uri, client, readTimeout).withAttempts(attempts);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            log.warn(
                "Transient status {} from {} (attempt {}/{}), retrying",
                lastResult.statusCode(),
                request.url(),
                attempt,
                maxAttempts
            );
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private FetchResult executeOnce(String url, URI uri, HttpClient client, Duration readTimeout) {
        Instant startedAt = Instant.now();
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        Semaphore hostLimiter = hostLimiters.computeIfAbsent(
            host,
            ignored -> new Semaphore(properties.getHttp().getPoolSize())
        );
        boolean acquired = false;
        boolean hostAcquired = false;
        try {
            acquired = globalLimiter.tryAcquire(readTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                return FetchResult.failure(url, startedAt, FetchFailureKind.TRANSPORT_ERROR, "connection pool exhausted", 1);
            }
            hostAcquired = hostLimiter.tryAcquire(readTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!hostAcquired) {
                return FetchResult.failure(url, startedAt, FetchFailureKind.TRANSPORT_ERROR, "host connection limit reached", 1);
            }

            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(readTimeout)
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", ACCEPT_HTML)
                .header("Accept-Language", "en-US,en;q=0.8")
                .GET()
                .build();

            metrics.recordRequest();
            HttpResponse<byte[]> response = awaitResponse(
                client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray()),
                readTimeout
            );
            byte[] responseBytes = response.body();
            String responseBody = responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8);
            Instant now = Instant.now();
            log.debug("GET {} -> {} in {}", url, response.statusCode(), Duration.between(startedAt, now));
            return new FetchResult(
                url,
                response.statusCode(),
                responseBody,
                responseBytes,
                response.headers().firstValue("Content-Type").orElse(null),
                now,
                Duration.between(startedAt, now),
                null,
                null,
                1
            );
        } catch (TimeoutException e) {
            return FetchResult.failure(
                url,
                startedAt,
                FetchFailureKind.READ_TIMEOUT,
                "response not complete within " + readTimeout,
                1
            );
        } catch (HttpConnectTimeoutException e) {
            return FetchResult.failure(url, startedAt, FetchFailureKind.CONNECT_TIMEOUT, e.getMessage(), 1);
        } catch (HttpTimeoutException e) {
            return FetchResult.failure(url, startedAt, FetchFailureKind.READ_TIMEOUT, e.getMessage(), 1);
        } catch (IOException e) {
            log.debug("GET {} failed", url, e);
            return FetchResult.failure(url, startedAt, FetchFailureKind.TRANSPORT_ERROR, describe(e), 1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failure(url, startedAt, FetchFailureKind.INTERRUPTED, e.getMessage(), 1);
        } catch (Exception e) {
            log.debug("GET {} failed", url, e);
            return FetchResult.failure(url, startedAt, FetchFailureKind.TRANSPORT_ERROR, describe(e), 1);
        } finally {
            if (hostAcquired) {
                hostLimiter.release();
            }
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    // The request timeout only covers the headers; the future bounds the body read as well.
    private static HttpResponse<byte[]> awaitResponse(
        CompletableFuture<HttpResponse<byte[]>> pending,
        Duration readTimeout
    ) throws IOException, InterruptedException, TimeoutException {
        try {
            return pending.get(readTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            pending.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IOException(cause == null ? e.getMessage() : cause.getMessage(), cause);
        }
    }

    private boolean shouldRetry(FetchResult result) {
        if (result == null || result.isFailure()) {
            return false;
        }
        return RETRYABLE_STATUSES.contains(result.statusCode());
    }

    private boolean sleepBackoff(int attempt) {
        long baseDelayMs = properties.getHttp().getRetryBaseDelay().toMillis();
        if (baseDelayMs <= 0) {
            return true;
        }
        long maxDelayMs = properties.getHttp().getRetryMaxDelay().toMillis();
        long delay = baseDelayMs * (1L << Math.min(20, Math.max(0, attempt - 1)));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 0) {
            return true;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        long sleepMs = (delay / 2) + jitter;
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static HttpClient buildClient(Duration connectTimeout, SSLContext sslContext, ExecutorService executor) {
        return HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(connectTimeout)
            .version(HttpClient.Version.HTTP_1_1)
            .sslContext(sslContext)
            .executor(executor)
            .build();
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
