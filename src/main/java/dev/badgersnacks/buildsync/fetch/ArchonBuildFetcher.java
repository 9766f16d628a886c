package dev.badgersnacks.buildsync.fetch;

import com.google.common.util.concurrent.RateLimiter;
import dev.badgersnacks.buildsync.config.UpdaterSettings;
import dev.badgersnacks.buildsync.mapping.IdentifierMapper;
import dev.badgersnacks.buildsync.model.FetchOutcome;
import dev.badgersnacks.buildsync.model.FetchTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fetches build pages over HTTP and extracts the talent code. Every request first takes a permit
 * from the shared {@link RateLimiter}, so all workers using this instance draw from one budget.
 */
public class ArchonBuildFetcher implements BuildFetcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArchonBuildFetcher.class);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(15);

    private final HttpClient client;
    private final RateLimiter rateLimiter;
    private final ArchonUrls urls;
    private final BuildCodeLocator locator;
    private final IdentifierMapper mapper;
    private final Duration requestTimeout;
    private final String userAgent;
    private final Set<Integer> noDataStatuses;

    public ArchonBuildFetcher(UpdaterSettings settings, IdentifierMapper mapper) {
        this(HttpClient.newBuilder()
                        .connectTimeout(CONNECT_TIMEOUT)
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                RateLimiter.create(settings.requestsPerSecond()),
                settings,
                mapper);
    }

    public ArchonBuildFetcher(HttpClient client,
                              RateLimiter rateLimiter,
                              UpdaterSettings settings,
                              IdentifierMapper mapper) {
        this.client = Objects.requireNonNull(client, "client");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.urls = new ArchonUrls(settings.baseUrl(), mapper);
        this.locator = new BuildCodeLocator();
        this.requestTimeout = settings.requestTimeout();
        this.userAgent = settings.userAgent();
        this.noDataStatuses = settings.noDataStatuses();
    }

    @Override
    public FetchOutcome fetch(FetchTarget target) {
        URI uri;
        String classSlug;
        String specSlug;
        try {
            uri = urls.targetUri(target);
            classSlug = mapper.classToken(target.character().className());
            specSlug = mapper.specToken(target.character().className(), target.specialization());
        } catch (IllegalArgumentException e) {
            return FetchOutcome.transportError("Cannot build request for " + target.describe() + ": " + e.getMessage());
        }

        rateLimiter.acquire();
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("User-Agent", userAgent)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = send(request);
        } catch (HttpTimeoutException | TimeoutException e) {
            LOGGER.warn("Timed out after {}s fetching {}", requestTimeout.toSeconds(), uri);
            return FetchOutcome.transportError("Timed out after " + requestTimeout.toSeconds() + "s");
        } catch (IOException e) {
            LOGGER.warn("Failed to fetch {}: {}", uri, e.toString());
            return FetchOutcome.transportError(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchOutcome.transportError("Interrupted while fetching " + uri);
        }

        int status = response.statusCode();
        if (noDataStatuses.contains(status)) {
            LOGGER.debug("HTTP {} for {} treated as no data", status, uri);
            return FetchOutcome.notAvailable();
        }
        if (status < 200 || status >= 300) {
            LOGGER.warn("HTTP {} for {}", status, uri);
            return FetchOutcome.transportError("HTTP " + status);
        }

        Optional<String> code = locator.locate(response.body(), classSlug, specSlug);
        if (code.isEmpty()) {
            LOGGER.debug("No {} {} build link on {}", specSlug, classSlug, uri);
            return FetchOutcome.notAvailable();
        }
        return FetchOutcome.found(code.get());
    }

    /**
     * Waits at most the request timeout for the whole response, body included. The request's own
     * timeout only covers the wait for the response headers.
     */
    private HttpResponse<String> send(HttpRequest request)
            throws IOException, InterruptedException, TimeoutException {
        CompletableFuture<HttpResponse<String>> future =
                client.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        try {
            return future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException(cause);
        } finally {
            future.cancel(true);
        }
    }
}
